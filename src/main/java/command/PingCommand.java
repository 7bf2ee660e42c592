package command;

import protocol.RespValue;

import java.util.List;

public class PingCommand implements Command {

    private static final RespValue PONG = RespValue.simpleString("PONG");

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() != 1) {
            return Command.wrongArity("ping");
        }
        return PONG;
    }
}
