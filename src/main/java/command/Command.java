package command;

import protocol.RespValue;

import java.util.List;

/**
 * 모든 명령어 클래스가 구현해야 하는 공통 인터페이스
 */
public interface Command {

    /**
     * 명령어 실행 로직
     *
     * @param args 명령어 이름을 포함한 전체 인자 리스트
     * @return 클라이언트에게 보낼 응답. 사용자 오류는 예외 대신 에러 응답으로 반환
     */
    RespValue execute(List<String> args);

    static RespValue wrongArity(String name) {
        return RespValue.error("wrong number of arguments for '" + name + "' command");
    }
}
