package protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RespReaderTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testDecodeEcho() {
        RespReader reader = new RespReader(bytes("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n"));
        assertEquals(List.of("ECHO", "hi"), reader.readCommand());
        assertEquals(22, reader.getPosition());
        assertNull(reader.readCommand(), "Buffer ending on a frame boundary has nothing more to read");
    }

    @Test
    public void testDecodePing() {
        assertEquals(List.of("PING"), new RespReader(bytes("*1\r\n$4\r\nPING\r\n")).readCommand());
    }

    @Test
    public void testEmptyArrayIsEmptyCommand() {
        List<String> args = new RespReader(bytes("*0\r\n")).readCommand();
        assertNotNull(args);
        assertTrue(args.isEmpty());
    }

    @Test
    public void testEmptyBulkString() {
        assertEquals(List.of("ECHO", ""), new RespReader(bytes("*2\r\n$4\r\nECHO\r\n$0\r\n\r\n")).readCommand());
    }

    @Test
    public void testValueContainingCrlfUsesDeclaredLength() {
        RespReader reader = new RespReader(bytes("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$4\r\na\r\nb\r\n"));
        assertEquals(List.of("SET", "k", "a\r\nb"), reader.readCommand());
    }

    @Test
    public void testMultiByteValue() {
        String value = "héllo✓";
        byte[] encoded = bytes(value);
        String frame = "*2\r\n$4\r\nECHO\r\n$" + encoded.length + "\r\n" + value + "\r\n";
        assertEquals(List.of("ECHO", value), new RespReader(bytes(frame)).readCommand());
    }

    @Test
    public void testIncompleteFrameDoesNotConsume() {
        String full = "*2\r\n$4\r\nECHO\r\n$5\r\nhello\r\n";
        for (int cut = 1; cut < full.length(); cut++) {
            byte[] partial = bytes(full.substring(0, cut));
            RespReader reader = new RespReader(partial);
            assertNull(reader.readCommand(), "cut at " + cut);
            assertEquals(0, reader.getPosition(), "cut at " + cut);
        }
    }

    @Test
    public void testPipelinedFrames() {
        RespReader reader = new RespReader(bytes("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n*1\r\n$4\r\nPI"));
        assertEquals(List.of("PING"), reader.readCommand());
        assertEquals(List.of("GET", "k"), reader.readCommand());
        int beforePartial = reader.getPosition();
        assertNull(reader.readCommand());
        assertEquals(beforePartial, reader.getPosition());
    }

    @Test
    public void testOffsetAndLimit() {
        byte[] data = bytes("xx*1\r\n$4\r\nPING\r\nyy");
        RespReader reader = new RespReader(data, 2, data.length - 2);
        assertEquals(List.of("PING"), reader.readCommand());
        assertEquals(data.length - 2, reader.getPosition());
    }

    @Test
    public void testNonIntegerLengthIsFormatError() {
        RespReader reader = new RespReader(bytes("*1\r\n$abc\r\nPING\r\n"));
        RespFormatException e = assertThrows(RespFormatException.class, reader::readCommand);
        assertTrue(e.getMessage().contains("abc"));
    }

    @Test
    public void testNegativeLengthIsFormatError() {
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*1\r\n$-1\r\n")).readCommand());
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*-1\r\n")).readCommand());
    }

    @Test
    public void testNonIntegerCountIsFormatError() {
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*x\r\n$4\r\nPING\r\n")).readCommand());
    }

    @Test
    public void testMissingArrayHeaderIsFormatError() {
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("PING\r\n")).readCommand());
    }

    @Test
    public void testElementWithoutBulkPrefixIsFormatError() {
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*1\r\n+PING\r\n")).readCommand());
    }

    @Test
    public void testPayloadLongerThanDeclaredIsFormatError() {
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*1\r\n$2\r\nPING\r\n")).readCommand());
    }

    @Test
    public void testMaxIntBulkLengthIsFormatError() {
        RespReader reader = new RespReader(bytes("*1\r\n$2147483647\r\nPING\r\n"));
        RespFormatException e = assertThrows(RespFormatException.class, reader::readCommand);
        assertTrue(e.getMessage().contains("exceeds limit"), e.getMessage());
    }

    @Test
    public void testBulkLengthAboveLimitIsFormatError() {
        String frame = "*1\r\n$" + (RespReader.MAX_BULK_LENGTH + 1L) + "\r\nPING\r\n";
        assertThrows(RespFormatException.class, () -> new RespReader(bytes(frame)).readCommand());

        String beyondLong = "*1\r\n$99999999999999999999\r\nPING\r\n";
        assertThrows(RespFormatException.class, () -> new RespReader(bytes(beyondLong)).readCommand());
    }

    @Test
    public void testBulkLengthAtLimitWaitsForMoreBytes() {
        RespReader reader = new RespReader(bytes("*1\r\n$" + RespReader.MAX_BULK_LENGTH + "\r\nPING\r\n"));
        assertNull(reader.readCommand());
        assertEquals(0, reader.getPosition());
    }

    @Test
    public void testArrayLengthAboveLimitIsFormatError() {
        String frame = "*" + (RespReader.MAX_ARRAY_LENGTH + 1) + "\r\n$4\r\nPING\r\n";
        assertThrows(RespFormatException.class, () -> new RespReader(bytes(frame)).readCommand());
    }

    @Test
    public void testSignedOrEmptyLengthIsFormatError() {
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*1\r\n$+4\r\nPING\r\n")).readCommand());
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*+1\r\n$4\r\nPING\r\n")).readCommand());
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*1\r\n$\r\nPING\r\n")).readCommand());
        assertThrows(RespFormatException.class, () -> new RespReader(bytes("*1\r\n$ 4\r\nPING\r\n")).readCommand());
    }
}
