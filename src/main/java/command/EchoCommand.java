package command;

import protocol.RespValue;

import java.util.List;

public class EchoCommand implements Command {

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() != 2) {
            return Command.wrongArity("echo");
        }
        return RespValue.bulkString(args.get(1));
    }
}
