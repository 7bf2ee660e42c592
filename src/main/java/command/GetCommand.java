package command;

import protocol.RespValue;
import service.StorageService;

import java.util.List;

public class GetCommand implements Command {

    private final StorageService storageService;

    public GetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() != 2) {
            return Command.wrongArity("get");
        }
        // 없거나 만료된 키는 null -> null bulk string
        return RespValue.bulkString(storageService.getLive(args.get(1)));
    }
}
