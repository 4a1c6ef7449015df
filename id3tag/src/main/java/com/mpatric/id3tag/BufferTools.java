package com.mpatric.id3tag;

import java.nio.charset.StandardCharsets;

/**
 * Byte-level helpers shared by the header, frame and ID3v1 codecs: bit-padded
 * ("syncsafe") integers, the unsynchronisation scheme, terminator searches and
 * fixed-width Latin-1 strings.
 */
public final class BufferTools {

    /** Significant bits per byte in a syncsafe integer. */
    public static final int SYNCSAFE_BITS = 7;
    /** Significant bits per byte in a plain big-endian integer. */
    public static final int NORMAL_BITS = 8;

    private BufferTools() {}

    public static boolean checkBit(byte b, int bitPosition) {
        return ((b & (0x01 << bitPosition)) != 0);
    }

    public static byte setBit(byte b, int bitPosition, boolean value) {
        byte newByte;
        if (value) {
            newByte = (byte) (b | ((byte) 0x01 << bitPosition));
        } else {
            newByte = (byte) (b & (~((byte) 0x01 << bitPosition)));
        }
        return newByte;
    }

    /**
     * Decodes a big-endian integer where each byte contributes only its low {@code bits}
     * bits. Never fails; the caller is responsible for the bounds.
     *
     * @param bytes source buffer
     * @param offset index of the most significant byte
     * @param length number of bytes
     * @param bits 7 for syncsafe, 8 for normal integers
     * @return the decoded value
     */
    public static long unpackBitPaddedInteger(byte[] bytes, int offset, int length, int bits) {
        long mask = (1L << bits) - 1;
        long value = 0;
        for (int i = offset; i < offset + length; i++) {
            value = (value << bits) | (bytes[i] & mask);
        }
        return value;
    }

    /**
     * Encodes {@code value} into {@code width} bytes, each carrying {@code bits}
     * significant bits, most significant byte first. Bits that do not fit are dropped.
     */
    public static byte[] packBitPaddedInteger(long value, int width, int bits) {
        byte[] bytes = new byte[width];
        long mask = (1L << bits) - 1;
        long remaining = value;
        for (int i = width - 1; i >= 0; i--) {
            bytes[i] = (byte) (remaining & mask);
            remaining >>>= bits;
        }
        return bytes;
    }

    public static int unpackSynchsafeInteger(byte[] bytes, int offset) {
        return (int) unpackBitPaddedInteger(bytes, offset, 4, SYNCSAFE_BITS);
    }

    public static byte[] packSynchsafeInteger(int i) {
        return packBitPaddedInteger(i, 4, SYNCSAFE_BITS);
    }

    public static long unpackInteger(byte[] bytes, int offset) {
        return unpackBitPaddedInteger(bytes, offset, 4, NORMAL_BITS);
    }

    public static byte[] packInteger(int i) {
        return packBitPaddedInteger(i & 0xffffffffL, 4, NORMAL_BITS);
    }

    /**
     * @return true if no byte in the range has its high bit set, i.e. the range could be
     *     a syncsafe integer
     */
    public static boolean hasValidSynchsafePadding(byte[] bytes, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            if ((bytes[i] & 0x80) != 0) return false;
        }
        return true;
    }

    /**
     * Applies unsynchronisation: a {@code 0x00} is inserted after every {@code 0xFF}.
     *
     * @param bytes data to unsynchronise
     * @return a new buffer, or {@code bytes} itself if it contains no {@code 0xFF}
     */
    public static byte[] unsynchroniseBuffer(byte[] bytes) {
        int count = 0;
        for (byte b : bytes) {
            if (b == (byte) 0xff) count++;
        }
        if (count == 0) return bytes;
        byte[] newBuffer = new byte[bytes.length + count];
        int j = 0;
        for (byte b : bytes) {
            newBuffer[j++] = b;
            if (b == (byte) 0xff) {
                newBuffer[j++] = 0;
            }
        }
        return newBuffer;
    }

    /**
     * Reverses unsynchronisation: every {@code 0x00} immediately following a {@code 0xFF}
     * is dropped. Only the single byte after each {@code 0xFF} is considered, so
     * {@code FF 00 00} becomes {@code FF 00}.
     *
     * @param bytes unsynchronised data
     * @return the synchronised data
     */
    public static byte[] synchroniseBuffer(byte[] bytes) {
        byte[] newBuffer = new byte[bytes.length];
        int j = 0;
        int i = 0;
        while (i < bytes.length) {
            byte b = bytes[i];
            newBuffer[j++] = b;
            if (b == (byte) 0xff && i + 1 < bytes.length && bytes[i + 1] == 0) {
                i += 2;
                continue;
            }
            i++;
        }
        if (j == bytes.length) return newBuffer;
        return copyBuffer(newBuffer, 0, j);
    }

    public static byte[] copyBuffer(byte[] bytes, int offset, int length) {
        byte[] copy = new byte[length];
        if (length > 0) {
            System.arraycopy(bytes, offset, copy, 0, length);
        }
        return copy;
    }

    public static void copyIntoByteBuffer(
            byte[] bytes, int offset, int length, byte[] destBuffer, int destOffset) {
        if (length > 0) {
            System.arraycopy(bytes, offset, destBuffer, destOffset, length);
        }
    }

    /**
     * Finds the first null terminator of {@code terminatorLength} zero bytes in
     * {@code [fromIndex, toIndex)}. Two-byte terminators are only matched at even
     * distances from {@code fromIndex}.
     *
     * @return index of the terminator, or -1 if none
     */
    public static int indexOfTerminator(byte[] bytes, int fromIndex, int toIndex, int terminatorLength) {
        for (int i = fromIndex; i <= toIndex - terminatorLength; i += terminatorLength) {
            int matched;
            for (matched = 0; matched < terminatorLength; matched++) {
                if (bytes[i + matched] != 0) break;
            }
            if (matched == terminatorLength) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return true if the {@code length} bytes at {@code offset} are all uppercase ASCII
     *     letters or digits, the only characters allowed in a frame ID
     */
    public static boolean isValidFrameId(byte[] bytes, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            byte b = bytes[i];
            if (!((b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9'))) return false;
        }
        return true;
    }

    public static String byteBufferToStringIgnoringEncodingIssues(byte[] bytes, int offset, int length) {
        if (length < 1) return "";
        return new String(bytes, offset, length, StandardCharsets.ISO_8859_1);
    }

    /**
     * Decodes a fixed-width Latin-1 field: everything from the first null on is ignored
     * and trailing whitespace is trimmed.
     */
    public static String fixedWidthFieldToString(byte[] bytes, int offset, int length) {
        int end = offset;
        while (end < offset + length && bytes[end] != 0) {
            end++;
        }
        return trimStringRight(byteBufferToStringIgnoringEncodingIssues(bytes, offset, end - offset));
    }

    /**
     * Writes {@code s} as Latin-1 into a fixed-width field, truncating if it does not fit.
     * The remainder of the field is left untouched.
     */
    public static void stringIntoFixedWidthField(String s, byte[] bytes, int offset, int length) {
        byte[] srcBytes = s.getBytes(StandardCharsets.ISO_8859_1);
        copyIntoByteBuffer(srcBytes, 0, Math.min(srcBytes.length, length), bytes, offset);
    }

    public static String trimStringRight(String s) {
        int endPosition = s.length() - 1;
        char endChar;
        while (endPosition >= 0) {
            endChar = s.charAt(endPosition);
            if (endChar > 32) {
                break;
            }
            endPosition--;
        }
        if (endPosition == s.length() - 1) return s;
        else if (endPosition < 0) return "";
        return s.substring(0, endPosition + 1);
    }
}
