package protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RespProtocolTest {

    private static String encoded(RespValue value) {
        return new String(RespProtocol.encode(value), StandardCharsets.UTF_8);
    }

    @Test
    public void testEncodeSimpleString() {
        assertEquals("+PONG\r\n", encoded(RespValue.simpleString("PONG")));
    }

    @Test
    public void testEncodeError() {
        assertEquals("-ERR unknown command 'FOOX'\r\n", encoded(RespValue.error("unknown command 'FOOX'")));
    }

    @Test
    public void testEncodeBulkString() {
        assertEquals("$2\r\nhi\r\n", encoded(RespValue.bulkString("hi")));
        assertEquals("$0\r\n\r\n", encoded(RespValue.bulkString("")));
    }

    @Test
    public void testEncodeNullBulkString() {
        assertEquals("$-1\r\n", encoded(RespValue.nullBulkString()));
        assertEquals("$-1\r\n", encoded(RespValue.bulkString(null)));
    }

    @Test
    public void testEncodeArray() {
        assertEquals("*2\r\n$3\r\ndir\r\n$9\r\n/tmp/data\r\n", encoded(RespValue.array(List.of("dir", "/tmp/data"))));
        assertEquals("*0\r\n", encoded(RespValue.emptyArray()));
    }

    @Test
    public void testBulkLengthCountsBytesNotChars() {
        // 2 chars, 5 bytes in UTF-8
        String value = "é✓";
        assertEquals("$5\r\n" + value + "\r\n", encoded(RespValue.bulkString(value)));
        assertEquals("*1\r\n$5\r\n" + value + "\r\n", encoded(RespValue.array(List.of(value))));
    }

    @Test
    public void testBulkBytesSurviveRequestDecoding() {
        String value = "line1\r\nline2 ünïcode";
        byte[] bulk = RespProtocol.encode(RespValue.bulkString(value));

        byte[] request = RespProtocol.encodeCommand(List.of("ECHO", value));
        List<String> args = new RespReader(request).readCommand();
        assertEquals(List.of("ECHO", value), args);

        // the request carries the value's bulk encoding verbatim after the command name
        byte[] tail = Arrays.copyOfRange(request, request.length - bulk.length, request.length);
        assertArrayEquals(bulk, tail);
        assertArrayEquals(bulk, RespProtocol.encode(RespValue.bulkString(args.get(1))));
    }
}
