package command;

import protocol.RespValue;
import service.StorageService;

import java.util.List;

/**
 * KEYS 명령어. 패턴 "*"만 지원합니다.
 */
public class KeysCommand implements Command {

    private final StorageService storageService;

    public KeysCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() != 2) {
            return Command.wrongArity("keys");
        }
        if (!"*".equals(args.get(1))) {
            return RespValue.error("unsupported pattern '" + args.get(1) + "', only '*' is supported");
        }
        return RespValue.array(storageService.getLiveKeys());
    }
}
