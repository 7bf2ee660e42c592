package config;

import lombok.Getter;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 서버 설정을 관리하는 클래스
 * 시작 전에 명령행 인수로 채워지고, 실행 중에는 읽기 전용입니다.
 */
@Getter
public class ServerConfig {

    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_DIR = "/tmp";
    public static final String DEFAULT_DBFILENAME = "dump.rdb";

    private int port = DEFAULT_PORT;
    private String rdbDir = DEFAULT_DIR;
    private String rdbFilename = DEFAULT_DBFILENAME;

    public ServerConfig() {
    }

    public ServerConfig(String rdbDir, String rdbFilename) {
        this.rdbDir = rdbDir;
        this.rdbFilename = rdbFilename;
    }

    /**
     * 명령행 인수({@code --dir}, {@code --dbfilename}, {@code --port})를 파싱하여 설정을 업데이트합니다.
     * 값이 없는 플래그는 무시합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dir":
                    if (i + 1 < args.length) {
                        this.rdbDir = args[++i];
                    }
                    break;
                case "--dbfilename":
                    if (i + 1 < args.length) {
                        this.rdbFilename = args[++i];
                    }
                    break;
                case "--port":
                    if (i + 1 < args.length) {
                        try {
                            this.port = Integer.parseInt(args[++i]);
                        } catch (NumberFormatException e) {
                            System.err.println("Invalid port '" + args[i] + "', keeping " + this.port);
                        }
                    }
                    break;
                default:
                    System.err.println("Ignoring unknown argument: " + args[i]);
                    break;
            }
        }
    }

    /**
     * CONFIG 이름으로 설정 값을 찾습니다. 대소문자를 구분하지 않습니다.
     *
     * @return 설정 값, 알 수 없는 이름이면 {@code null}
     */
    public String lookup(String name) {
        switch (name.toLowerCase()) {
            case "dir":
                return rdbDir;
            case "dbfilename":
                return rdbFilename;
            default:
                return null;
        }
    }

    public Path getRdbPath() {
        return Paths.get(rdbDir, rdbFilename);
    }

    @Override
    public String toString() {
        return "port=" + port + ", dir=" + rdbDir + ", dbfilename=" + rdbFilename;
    }
}
