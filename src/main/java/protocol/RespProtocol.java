package protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RESP 응답 인코딩을 담당하는 클래스
 * 길이는 UTF-8 바이트 수로 기록합니다.
 */
public final class RespProtocol {

    public static final byte[] CRLF = {'\r', '\n'};
    public static final byte[] NULL_BULK_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespProtocol() {
    }

    /**
     * 응답을 RESP 바이트로 인코딩합니다.
     */
    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(out, '+', value.getText());
                break;
            case ERROR:
                writeLine(out, '-', value.getText());
                break;
            case BULK_STRING:
                writeBulkString(out, value.getText());
                break;
            case NULL_BULK:
                out.writeBytes(NULL_BULK_BYTES);
                break;
            case ARRAY:
                writeArray(out, value.getItems());
                break;
            default:
                throw new IllegalArgumentException("Unsupported reply type: " + value.getType());
        }
        return out.toByteArray();
    }

    /**
     * 명령어를 bulk string 배열(클라이언트 요청 형식)로 인코딩합니다.
     */
    public static byte[] encodeCommand(List<String> args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeArray(out, args);
        return out.toByteArray();
    }

    private static void writeArray(ByteArrayOutputStream out, List<String> items) {
        writeLine(out, '*', Integer.toString(items.size()));
        for (String item : items) {
            writeBulkString(out, item);
        }
    }

    private static void writeBulkString(ByteArrayOutputStream out, String value) {
        if (value == null) {
            out.writeBytes(NULL_BULK_BYTES);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeLine(out, '$', Integer.toString(bytes.length));
        out.writeBytes(bytes);
        out.writeBytes(CRLF);
    }

    private static void writeLine(ByteArrayOutputStream out, char prefix, String content) {
        out.write(prefix);
        out.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }
}
