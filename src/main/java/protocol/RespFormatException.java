package protocol;

/**
 * 요청이 올바른 RESP 형식이 아닐 때 발생하는 예외
 */
public class RespFormatException extends RuntimeException {

    public RespFormatException(String message) {
        super(message);
    }

    public RespFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
