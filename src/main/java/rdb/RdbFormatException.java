package rdb;

/**
 * 스냅샷 파일을 해석할 수 없을 때 발생하는 예외
 * 데이터를 신뢰할 수 없으므로 서버 시작을 중단합니다.
 */
public class RdbFormatException extends RuntimeException {

    public RdbFormatException(String message) {
        super(message);
    }
}
