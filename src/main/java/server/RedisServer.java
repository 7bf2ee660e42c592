package server;

import command.CommandHandler;
import config.ServerConfig;
import rdb.RdbLoader;
import service.StorageService;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * 서버 상태를 소유하고 클라이언트 연결을 받는 메인 클래스
 * 클라이언트마다 별도의 스레드로 처리합니다.
 */
public class RedisServer {

    private final ServerConfig config;
    private final StorageService storageService;
    private final CommandHandler commandHandler;
    private final RdbLoader rdbLoader;

    public RedisServer(ServerConfig config) {
        this(config, new StorageService());
    }

    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.storageService = storageService;
        this.commandHandler = new CommandHandler(config, storageService);
        this.rdbLoader = new RdbLoader(config, storageService);
    }

    /**
     * RDB 파일을 로드한 뒤 프로세스가 끝날 때까지 연결을 받습니다.
     *
     * @throws IOException RDB 파일을 읽을 수 없거나 포트를 바인딩할 수 없을 때
     * @throws rdb.RdbFormatException RDB 파일 형식이 잘못되었을 때
     */
    public void start() throws IOException {
        rdbLoader.loadRdbFile();

        try (ServerSocket serverSocket = createServerSocket(config.getPort())) {
            System.out.println("Server listening on port " + config.getPort() + " with " + storageService.size() + " keys");

            while (true) {
                try {
                    Socket clientSocket = serverSocket.accept();
                    System.out.println("Client connected: " + clientSocket.getRemoteSocketAddress());

                    ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler);
                    new Thread(clientHandler, "client-" + clientSocket.getPort()).start();
                } catch (IOException e) {
                    System.err.println("Error accepting client connection: " + e.getMessage());
                }
            }
        }
    }

    private ServerSocket createServerSocket(int port) throws IOException {
        ServerSocket serverSocket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(port));
        return serverSocket;
    }
}
