package rdb;

import config.ServerConfig;
import org.apache.commons.io.FileUtils;
import service.StorageService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static rdb.RdbConstants.*;

/**
 * RDB 파일의 문자열 키-값 레코드를 저장소로 로드하는 클래스
 * <p>
 * 만료 시간 opcode는 건너뛰고 다음 레코드에 연결하지 않으므로 로드된 키는 만료되지 않습니다.
 */
public class RdbLoader {

    private final ServerConfig config;
    private final StorageService storageService;

    public RdbLoader(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.storageService = storageService;
    }

    /**
     * 설정된 경로의 RDB 파일을 로드합니다. 파일이 없으면 빈 저장소로 시작합니다.
     *
     * @return 로드된 키 개수
     * @throws IOException 파일은 있지만 읽을 수 없을 때
     * @throws RdbFormatException 올바른 RDB 파일이 아닐 때
     */
    public int loadRdbFile() throws IOException {
        Path rdbPath = config.getRdbPath();

        if (!Files.exists(rdbPath)) {
            System.out.println("RDB file not found: " + rdbPath + ". Starting with empty database.");
            return 0;
        }

        byte[] rdbData = FileUtils.readFileToByteArray(rdbPath.toFile());
        int loaded = parseRdbFile(rdbData);
        System.out.println("RDB file loaded: " + rdbPath + " (" + loaded + " keys)");
        return loaded;
    }

    /**
     * RDB 파일 데이터를 파싱하여 저장소에 넣습니다.
     *
     * @return 저장한 키-값 레코드 개수
     */
    public int parseRdbFile(byte[] data) {
        if (data.length < HEADER.length || !Arrays.equals(data, 0, HEADER.length, HEADER, 0, HEADER.length)) {
            throw new RdbFormatException("Invalid RDB file header, expected " + new String(HEADER, StandardCharsets.US_ASCII));
        }

        int pos = HEADER.length;

        // 메타데이터 섹션
        while (byteAt(data, pos) == OPCODE_AUX) {
            RdbParseResult name = parseString(data, pos + 1);
            RdbParseResult value = parseString(data, name.nextPos);
            pos = value.nextPos;
            System.out.println("Metadata - " + name.stringValue + ": " + value.stringValue);
        }

        int loaded = 0;
        while (true) {
            int opcode = byteAt(data, pos);
            pos++;

            switch (opcode) {
                case OPCODE_EOF:
                    // 파일 끝, 뒤따르는 체크섬은 검증하지 않음
                    return loaded;
                case OPCODE_SELECTDB:
                    pos = parseSize(data, pos).nextPos;
                    break;
                case OPCODE_RESIZEDB:
                    RdbParseResult keyHashSize = parseSize(data, pos);
                    pos = parseSize(data, keyHashSize.nextPos).nextPos;
                    break;
                case OPCODE_EXPIRETIME_MS:
                    pos = skip(data, pos, 8);
                    break;
                case OPCODE_EXPIRETIME:
                    pos = skip(data, pos, 4);
                    break;
                case TYPE_STRING:
                    RdbParseResult key = parseString(data, pos);
                    RdbParseResult value = parseString(data, key.nextPos);
                    pos = value.nextPos;
                    storageService.set(key.stringValue, value.stringValue);
                    loaded++;
                    break;
                default:
                    throw new RdbFormatException("Unexpected opcode 0x" + Integer.toHexString(opcode) + " at offset " + (pos - 1));
            }
        }
    }

    /**
     * 크기 인코딩된 값을 파싱합니다.
     */
    private RdbParseResult parseSize(byte[] data, int pos) {
        int firstByte = byteAt(data, pos);
        int type = (firstByte & 0xC0) >> 6;

        switch (type) {
            case SIZE_6BIT:
                return new RdbParseResult(firstByte & 0x3F, pos + 1, null);
            case SIZE_14BIT:
                int size14 = ((firstByte & 0x3F) << 8) | byteAt(data, pos + 1);
                return new RdbParseResult(size14, pos + 2, null);
            case SIZE_32BIT:
                long size32 = 0;
                for (int i = 1; i <= 4; i++) {
                    size32 = (size32 << 8) | byteAt(data, pos + i);
                }
                if (size32 > Integer.MAX_VALUE) {
                    throw new RdbFormatException("Size " + size32 + " at offset " + pos + " is too large");
                }
                return new RdbParseResult((int) size32, pos + 5, null);
            default:
                throw new RdbFormatException("Unsupported size encoding 0x" + Integer.toHexString(firstByte) + " at offset " + pos);
        }
    }

    /**
     * 문자열을 파싱합니다. 크기 + 바이트 형식이거나 정수 인코딩입니다.
     */
    private RdbParseResult parseString(byte[] data, int pos) {
        int firstByte = byteAt(data, pos);
        if ((firstByte & 0xC0) >> 6 == ENCVAL) {
            return parseIntegerString(data, pos + 1, firstByte);
        }

        RdbParseResult sizeResult = parseSize(data, pos);
        int length = sizeResult.value;
        int start = sizeResult.nextPos;
        if (length > data.length - start) {
            throw new RdbFormatException("String of length " + length + " at offset " + start + " runs past end of file");
        }
        String stringValue = new String(data, start, length, StandardCharsets.UTF_8);
        return new RdbParseResult(length, start + length, stringValue);
    }

    // 정수는 little-endian 으로 저장됨
    private RdbParseResult parseIntegerString(byte[] data, int pos, int firstByte) {
        int width;
        switch (firstByte & 0x3F) {
            case ENC_INT8:
                width = 1;
                break;
            case ENC_INT16:
                width = 2;
                break;
            case ENC_INT32:
                width = 4;
                break;
            default:
                throw new RdbFormatException("Unsupported string encoding 0x" + Integer.toHexString(firstByte) + " at offset " + (pos - 1));
        }

        long value = 0;
        for (int i = 0; i < width; i++) {
            value |= ((long) byteAt(data, pos + i)) << (i * 8);
        }
        // 인코딩된 폭 기준으로 부호 확장
        int shift = 64 - width * 8;
        value = (value << shift) >> shift;
        return new RdbParseResult(width, pos + width, Long.toString(value));
    }

    private static int skip(byte[] data, int pos, int count) {
        if (count > data.length - pos) {
            throw new RdbFormatException("Unexpected end of file at offset " + pos);
        }
        return pos + count;
    }

    private static int byteAt(byte[] data, int pos) {
        if (pos >= data.length) {
            throw new RdbFormatException("Unexpected end of file at offset " + pos);
        }
        return data[pos] & 0xFF;
    }

    private static class RdbParseResult {
        final int value;
        final int nextPos;
        final String stringValue;

        RdbParseResult(int value, int nextPos, String stringValue) {
            this.value = value;
            this.nextPos = nextPos;
            this.stringValue = stringValue;
        }
    }
}
