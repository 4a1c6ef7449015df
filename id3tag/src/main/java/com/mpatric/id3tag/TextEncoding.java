package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * The four text encodings an ID3v2 frame may declare in its leading encoding byte.
 * Decoding is lenient: malformed sequences become replacement characters.
 */
public enum TextEncoding {

    ISO_8859_1(0, 1),
    /** UTF-16 with byte order mark; little-endian is assumed when the mark is missing. */
    UTF_16(1, 2),
    UTF_16BE(2, 2),
    /** Only legal from ID3v2.4 on. */
    UTF_8(3, 1);

    private static final byte[] BOM_LE = {(byte) 0xff, (byte) 0xfe};

    private final byte code;
    private final int terminatorLength;

    TextEncoding(int code, int terminatorLength) {
        this.code = (byte) code;
        this.terminatorLength = terminatorLength;
    }

    public byte getCode() {
        return code;
    }

    public int getTerminatorLength() {
        return terminatorLength;
    }

    public byte[] getTerminator() {
        return new byte[terminatorLength];
    }

    public static TextEncoding fromByte(byte b) throws InvalidDataException {
        switch (b) {
            case 0:
                return ISO_8859_1;
            case 1:
                return UTF_16;
            case 2:
                return UTF_16BE;
            case 3:
                return UTF_8;
            default:
                throw new InvalidDataException("Invalid text encoding byte: " + (b & 0xff));
        }
    }

    /** The encoding new frames get by default for the given major version. */
    public static TextEncoding defaultFor(int majorVersion) {
        return majorVersion >= 4 ? UTF_8 : UTF_16;
    }

    /**
     * The encoding actually written for a tag of {@code majorVersion}: UTF-8 becomes UTF-16
     * below v2.4, every other encoding is kept.
     */
    public TextEncoding forWriting(int majorVersion) {
        if (this == UTF_8 && majorVersion < 4) return UTF_16;
        return this;
    }

    public String decode(byte[] bytes, int offset, int length) {
        if (length <= 0) return "";
        switch (this) {
            case ISO_8859_1:
                return new String(bytes, offset, length, StandardCharsets.ISO_8859_1);
            case UTF_16:
                if (length < 2) return "";
                if (bytes[offset] == (byte) 0xff && bytes[offset + 1] == (byte) 0xfe) {
                    return new String(bytes, offset + 2, length - 2, StandardCharsets.UTF_16LE);
                }
                if (bytes[offset] == (byte) 0xfe && bytes[offset + 1] == (byte) 0xff) {
                    return new String(bytes, offset + 2, length - 2, StandardCharsets.UTF_16BE);
                }
                return new String(bytes, offset, length, StandardCharsets.UTF_16LE);
            case UTF_16BE:
                return new String(bytes, offset, length, StandardCharsets.UTF_16BE);
            default:
                return new String(bytes, offset, length, StandardCharsets.UTF_8);
        }
    }

    /**
     * Encodes {@code s} without a terminator. UTF-16 output is little-endian with a byte
     * order mark; characters Latin-1 cannot represent become {@code '?'}.
     */
    public byte[] encode(String s) {
        switch (this) {
            case ISO_8859_1:
                return s.getBytes(StandardCharsets.ISO_8859_1);
            case UTF_16:
                byte[] text = s.getBytes(StandardCharsets.UTF_16LE);
                byte[] withBom = new byte[text.length + 2];
                BufferTools.copyIntoByteBuffer(BOM_LE, 0, 2, withBom, 0);
                BufferTools.copyIntoByteBuffer(text, 0, text.length, withBom, 2);
                return withBom;
            case UTF_16BE:
                return s.getBytes(StandardCharsets.UTF_16BE);
            default:
                return s.getBytes(StandardCharsets.UTF_8);
        }
    }

    public int indexOfTerminator(byte[] bytes, int fromIndex, int toIndex) {
        return BufferTools.indexOfTerminator(bytes, fromIndex, toIndex, terminatorLength);
    }

    /**
     * Splits {@code [offset, offset + length)} on this encoding's terminator and decodes
     * each segment on its own, so every UTF-16 segment may carry its own byte order mark.
     * Empty trailing segments are dropped.
     */
    public List<String> decodeList(byte[] bytes, int offset, int length) {
        List<String> values = splitAndDecode(bytes, offset, length);
        while (!values.isEmpty() && values.get(values.size() - 1).isEmpty()) {
            values.remove(values.size() - 1);
        }
        return values;
    }

    /** Like {@link #decodeList} but keeps every segment, empty or not. */
    public List<String> splitAndDecode(byte[] bytes, int offset, int length) {
        List<String> values = new ArrayList<>();
        int end = offset + length;
        int start = offset;
        while (start < end) {
            int marker = indexOfTerminator(bytes, start, end);
            if (marker < 0) {
                values.add(decode(bytes, start, end - start));
                break;
            }
            values.add(decode(bytes, start, marker - start));
            start = marker + terminatorLength;
        }
        return values;
    }

    /** Encodes the values separated, not followed, by this encoding's terminator. */
    public byte[] encodeList(List<String> values) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) out.write(getTerminator(), 0, terminatorLength);
            byte[] value = encode(values.get(i));
            out.write(value, 0, value.length);
        }
        return out.toByteArray();
    }
}
