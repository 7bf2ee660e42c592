package command;

import protocol.RespValue;
import service.StorageService;

import java.util.List;

/**
 * SET key value [PX milliseconds | EX seconds]
 * <p>
 * 옵션이 없으면 키에 있던 기존 만료 시간을 제거합니다.
 */
public class SetCommand implements Command {

    private static final RespValue OK = RespValue.simpleString("OK");
    private static final RespValue NOT_AN_INTEGER = RespValue.error("value is not an integer or out of range");
    private static final RespValue SYNTAX_ERROR = RespValue.error("syntax error");

    private final StorageService storageService;

    public SetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() < 3) {
            return Command.wrongArity("set");
        }

        String key = args.get(1);
        String value = args.get(2);

        if (args.size() == 3) {
            storageService.set(key, value);
            return OK;
        }
        if (args.size() != 5) {
            return SYNTAX_ERROR;
        }

        String option = args.get(3);
        boolean milliseconds = "px".equalsIgnoreCase(option);
        if (!milliseconds && !"ex".equalsIgnoreCase(option)) {
            return SYNTAX_ERROR;
        }

        long ttlMs;
        try {
            long amount = Long.parseLong(args.get(4));
            ttlMs = milliseconds ? amount : Math.multiplyExact(amount, 1000L);
        } catch (NumberFormatException | ArithmeticException e) {
            return NOT_AN_INTEGER;
        }

        storageService.setWithTtl(key, value, ttlMs);
        return OK;
    }
}
