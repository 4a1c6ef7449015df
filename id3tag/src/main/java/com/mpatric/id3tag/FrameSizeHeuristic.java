package com.mpatric.id3tag;

/**
 * Decides how ID3v2.4 frame sizes are encoded. The format mandates syncsafe sizes, but
 * some encoders (several iTunes releases among them) write plain 32-bit integers. The
 * frame region is walked once per interpretation and the one that yields more valid
 * frame headers wins; a tie goes to syncsafe.
 */
public final class FrameSizeHeuristic {

    private static final int FRAME_HEADER_LENGTH = 10;
    private static final int FRAME_ID_LENGTH = 4;

    private FrameSizeHeuristic() {}

    /**
     * @param data buffer holding the frame region
     * @param offset first frame header
     * @param end end of the frame region (exclusive)
     * @return {@link BufferTools#SYNCSAFE_BITS} or {@link BufferTools#NORMAL_BITS}
     */
    public static int determineBitsPerInteger(byte[] data, int offset, int end) {
        int syncsafeFrames = countValidFrames(data, offset, end, BufferTools.SYNCSAFE_BITS);
        int normalFrames = countValidFrames(data, offset, end, BufferTools.NORMAL_BITS);
        return syncsafeFrames >= normalFrames ? BufferTools.SYNCSAFE_BITS : BufferTools.NORMAL_BITS;
    }

    static int countValidFrames(byte[] data, int offset, int end, int bits) {
        int count = 0;
        int position = offset;
        while (position + FRAME_HEADER_LENGTH <= end) {
            if (data[position] == 0) break;
            if (!BufferTools.isValidFrameId(data, position, FRAME_ID_LENGTH)) break;
            long size = BufferTools.unpackBitPaddedInteger(data, position + FRAME_ID_LENGTH, 4, bits);
            if (size == 0 || position + FRAME_HEADER_LENGTH + size > end) break;
            count++;
            position += FRAME_HEADER_LENGTH + (int) size;
        }
        return count;
    }
}
