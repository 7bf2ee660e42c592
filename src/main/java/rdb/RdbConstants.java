package rdb;

import java.nio.charset.StandardCharsets;

/**
 * RDB 스냅샷 파일 상수
 */
public final class RdbConstants {

    public static final byte[] HEADER = "REDIS0011".getBytes(StandardCharsets.US_ASCII);

    // OpCodes
    public static final int OPCODE_EOF = 0xFF;
    public static final int OPCODE_SELECTDB = 0xFE;
    public static final int OPCODE_EXPIRETIME = 0xFD;
    public static final int OPCODE_EXPIRETIME_MS = 0xFC;
    public static final int OPCODE_RESIZEDB = 0xFB;
    public static final int OPCODE_AUX = 0xFA;

    // 값 타입
    public static final int TYPE_STRING = 0x00;

    // 크기 인코딩 (첫 바이트의 상위 2비트)
    public static final int SIZE_6BIT = 0;
    public static final int SIZE_14BIT = 1;
    public static final int SIZE_32BIT = 2;
    public static final int ENCVAL = 3;

    // ENCVAL 일 때의 문자열 인코딩
    public static final int ENC_INT8 = 0;
    public static final int ENC_INT16 = 1;
    public static final int ENC_INT32 = 2;

    private RdbConstants() {
    }
}
