import config.ServerConfig;
import rdb.RdbFormatException;
import server.RedisServer;

import java.io.IOException;

/**
 * 서버 애플리케이션의 진입점
 */
public class Main {

    public static void main(String[] args) {
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(args);
        System.out.println("Starting server: " + config);

        RedisServer server = new RedisServer(config);
        try {
            server.start();
        } catch (RdbFormatException e) {
            System.err.println("Malformed RDB file " + config.getRdbPath() + ": " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Failed to start server: " + e.getMessage());
            System.exit(1);
        }
    }
}
