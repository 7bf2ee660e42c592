package command;

import config.ServerConfig;
import protocol.RespValue;

import java.util.List;

/**
 * CONFIG GET 명령어. 알 수 없는 설정 이름에는 빈 배열을 반환합니다.
 */
public class ConfigCommand implements Command {

    private final ServerConfig serverConfig;

    public ConfigCommand(ServerConfig serverConfig) {
        this.serverConfig = serverConfig;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() < 2) {
            return Command.wrongArity("config");
        }
        if (!"get".equalsIgnoreCase(args.get(1))) {
            return RespValue.error("unknown subcommand '" + args.get(1) + "'");
        }
        if (args.size() != 3) {
            return Command.wrongArity("config|get");
        }

        String configName = args.get(2).toLowerCase();
        String value = serverConfig.lookup(configName);
        if (value == null) {
            return RespValue.emptyArray();
        }
        return RespValue.array(List.of(configName, value));
    }
}
