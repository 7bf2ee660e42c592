package command;

import config.ServerConfig;
import protocol.RespValue;
import service.StorageService;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 첫 번째 토큰으로 명령어를 찾아 실행하는 핸들러 클래스
 * 명령어 안에서 발생한 모든 오류는 에러 응답으로 변환되고, 호출자에게 예외를 던지지 않습니다.
 */
public class CommandHandler {

    private final Map<String, Command> commandMap = new HashMap<>();

    public CommandHandler(ServerConfig serverConfig, StorageService storageService) {
        commandMap.put("ping", new PingCommand());
        commandMap.put("echo", new EchoCommand());
        commandMap.put("set", new SetCommand(storageService));
        commandMap.put("get", new GetCommand(storageService));
        commandMap.put("keys", new KeysCommand(storageService));
        commandMap.put("config", new ConfigCommand(serverConfig));
    }

    public RespValue execute(List<String> args) {
        if (args.isEmpty()) {
            return RespValue.error("empty command");
        }

        String commandName = args.get(0);
        Command command = commandMap.get(commandName.toLowerCase());
        if (command == null) {
            return RespValue.error("unknown command '" + commandName + "'");
        }

        try {
            return command.execute(args);
        } catch (RuntimeException e) {
            System.err.println("Error executing " + commandName + ": " + e);
            return RespValue.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
