package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 명령어가 만드는 응답 값. {@link RespProtocol#encode(RespValue)}로 인코딩됩니다.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RespValue {

    private static final RespValue NULL_BULK = new RespValue(RespType.NULL_BULK, null, null);

    private final RespType type;
    private final String text;
    private final List<String> items;

    private RespValue(RespType type, String text, List<String> items) {
        this.type = type;
        this.text = text;
        this.items = items;
    }

    public static RespValue simpleString(String value) {
        return new RespValue(RespType.SIMPLE_STRING, value, null);
    }

    /**
     * {@code ERR} 접두사가 붙은 에러 응답
     */
    public static RespValue error(String message) {
        return new RespValue(RespType.ERROR, "ERR " + message, null);
    }

    /**
     * bulk string 응답. {@code null}이면 null bulk string이 됩니다.
     */
    public static RespValue bulkString(String value) {
        if (value == null) {
            return NULL_BULK;
        }
        return new RespValue(RespType.BULK_STRING, value, null);
    }

    public static RespValue nullBulkString() {
        return NULL_BULK;
    }

    public static RespValue array(List<String> items) {
        return new RespValue(RespType.ARRAY, null, Collections.unmodifiableList(items));
    }

    public static RespValue emptyArray() {
        return array(Collections.emptyList());
    }
}
