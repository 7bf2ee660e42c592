package protocol;

/**
 * 서버가 보낼 수 있는 RESP 응답 타입
 */
public enum RespType {
    SIMPLE_STRING,  // +OK\r\n
    ERROR,          // -ERR msg\r\n
    BULK_STRING,    // $5\r\nhello\r\n
    NULL_BULK,      // $-1\r\n
    ARRAY           // *2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n
}
