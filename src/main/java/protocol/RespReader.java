package protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 바이트 버퍼 위의 커서로 요청 프레임(bulk string 배열)을 디코딩하는 클래스
 * <p>
 * bulk 데이터는 선언된 길이만큼 읽으므로 값 안에 CRLF가 있어도 됩니다.
 * 버퍼가 프레임 중간에서 끝나면 {@link #readCommand()}는 {@code null}을 반환하고
 * 위치를 프레임 시작으로 되돌립니다. 호출자는 바이트를 더 받은 뒤 다시 시도합니다.
 */
public class RespReader {

    // 실제 Redis 서버와 같은 한도
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    private final byte[] data;
    private final int limit;
    private int position;

    public RespReader(byte[] data) {
        this(data, 0, data.length);
    }

    public RespReader(byte[] data, int offset, int limit) {
        this.data = data;
        this.position = offset;
        this.limit = limit;
    }

    /**
     * 명령어 프레임 하나를 디코딩합니다.
     *
     * @return 순서대로 된 인자 목록 (비어 있을 수 있음), 프레임이 아직 다 오지 않았으면 {@code null}
     * @throws RespFormatException 올바른 요청 프레임이 아닐 때
     */
    public List<String> readCommand() {
        if (position >= limit) {
            return null;
        }
        int frameStart = position;
        if (data[position] != '*') {
            throw new RespFormatException("expected '*', got '" + (char) data[position] + "'");
        }

        Integer count = readLength(MAX_ARRAY_LENGTH);
        if (count == null) {
            position = frameStart;
            return null;
        }

        List<String> args = new ArrayList<>(Math.min(count, 16));
        for (int i = 0; i < count; i++) {
            String arg = readBulkString();
            if (arg == null) {
                position = frameStart;
                return null;
            }
            args.add(arg);
        }
        return args;
    }

    /**
     * 마지막으로 완전히 디코딩한 프레임 바로 다음 위치
     */
    public int getPosition() {
        return position;
    }

    private String readBulkString() {
        if (position >= limit) {
            return null;
        }
        if (data[position] != '$') {
            throw new RespFormatException("expected '$', got '" + (char) data[position] + "'");
        }
        Integer length = readLength(MAX_BULK_LENGTH);
        if (length == null) {
            return null;
        }
        // long 연산: length + 2 는 int 범위를 넘을 수 있음
        if ((long) limit - position < (long) length + 2) {
            return null;
        }
        String value = new String(data, position, length, StandardCharsets.UTF_8);
        position += length;
        if (data[position] != '\r' || data[position + 1] != '\n') {
            throw new RespFormatException("bulk string of length " + length + " is not followed by CRLF");
        }
        position += 2;
        return value;
    }

    /**
     * "{prefix}{숫자}\r\n" 을 읽어 0 이상 {@code max} 이하의 값을 반환합니다. 줄이 끝나지 않았으면 null.
     */
    private Integer readLength(int max) {
        int lineEnd = findCrlf(position + 1);
        if (lineEnd < 0) {
            return null;
        }
        char prefix = (char) data[position];
        String digits = new String(data, position + 1, lineEnd - position - 1, StandardCharsets.US_ASCII);
        if (digits.startsWith("-")) {
            throw new RespFormatException("negative length " + digits + " after '" + prefix + "'");
        }
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new RespFormatException("invalid length '" + digits + "' after '" + prefix + "'");
        }
        long length;
        try {
            length = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // 숫자만 있지만 long 범위를 넘는 경우
            length = Long.MAX_VALUE;
        }
        if (length > max) {
            throw new RespFormatException("length " + digits + " after '" + prefix + "' exceeds limit " + max);
        }
        position = lineEnd + 2;
        return (int) length;
    }

    private int findCrlf(int from) {
        for (int i = from; i + 1 < limit; i++) {
            if (data[i] == '\r' && data[i + 1] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
