package com.mpatric.id3tag;

/**
 * Renders a complete ID3v2 tag: header, frames and zero padding. Tags are always written
 * without unsynchronisation, extended header or footer.
 */
public final class ID3v2TagWriter {

    public static final int DEFAULT_PADDING = 1024;
    public static final int DEFAULT_VERSION = 4;

    // largest value a four-byte syncsafe integer holds
    private static final int MAX_TAG_SIZE = 0x0FFFFFFF;

    private ID3v2TagWriter() {}

    public static byte[] render(ID3v2Tags tags) {
        return render(tags, DEFAULT_VERSION, DEFAULT_PADDING);
    }

    public static byte[] render(ID3v2Tags tags, int majorVersion) {
        return render(tags, majorVersion, DEFAULT_PADDING);
    }

    /**
     * @param majorVersion 3 or 4
     * @param padding number of zero bytes after the last frame
     * @throws IllegalArgumentException for any other version or a negative padding
     */
    public static byte[] render(ID3v2Tags tags, int majorVersion, int padding) {
        if (padding < 0) throw new IllegalArgumentException("Negative padding: " + padding);
        byte[] frames = tags.render(majorVersion);
        long size = (long) frames.length + padding;
        if (size > MAX_TAG_SIZE) throw new IllegalArgumentException("Tag too large: " + size + " bytes");
        ID3v2Header header = new ID3v2Header(majorVersion, 0, false, false, false, false, (int) size, 0);
        byte[] bytes = new byte[ID3v2Header.HEADER_LENGTH + (int) size];
        BufferTools.copyIntoByteBuffer(header.toBytes(), 0, ID3v2Header.HEADER_LENGTH, bytes, 0);
        BufferTools.copyIntoByteBuffer(frames, 0, frames.length, bytes, ID3v2Header.HEADER_LENGTH);
        return bytes;
    }
}
