package com.mpatric.id3tag;

import java.nio.charset.StandardCharsets;

/**
 * The fixed ten-byte ID3v2 header: {@code "ID3"}, major version, revision, flags and the
 * syncsafe size of everything after the header (footer excluded).
 */
public class ID3v2Header {

    public static final String TAG = "ID3";
    public static final int HEADER_LENGTH = 10;
    public static final int FOOTER_LENGTH = 10;
    public static final int MAJOR_VERSION_OFFSET = 3;
    public static final int MINOR_VERSION_OFFSET = 4;
    public static final int FLAGS_OFFSET = 5;
    public static final int DATA_LENGTH_OFFSET = 6;

    private static final int UNSYNCHRONISATION_BIT = 7;
    private static final int EXTENDED_HEADER_BIT = 6;
    private static final int EXPERIMENTAL_BIT = 5;
    private static final int FOOTER_BIT = 4;

    private final int majorVersion;
    private final int revision;
    private final boolean unsynchronisation;
    private final boolean extendedHeader;
    private final boolean experimental;
    private final boolean footer;
    private final int size;
    private final long offset;

    public ID3v2Header(int majorVersion, int revision, boolean unsynchronisation, boolean extendedHeader,
            boolean experimental, boolean footer, int size, long offset) {
        this.majorVersion = majorVersion;
        this.revision = revision;
        this.unsynchronisation = unsynchronisation;
        this.extendedHeader = extendedHeader;
        this.experimental = experimental;
        this.footer = footer && majorVersion == 4;
        this.size = size;
        this.offset = offset;
    }

    public static ID3v2Header parse(byte[] bytes, long offset) throws NoSuchTagException, UnsupportedTagException {
        return parse(bytes, 0, bytes.length, offset);
    }

    /**
     * Parses the header at {@code bytes[from]}.
     *
     * @param bytes buffer holding the candidate header
     * @param from index of the first header byte
     * @param available number of readable bytes starting at {@code from}
     * @param offset position of the header in the file, kept for reference
     * @return the header
     * @throws NoSuchTagException if fewer than ten bytes are available or the magic is missing
     * @throws UnsupportedTagException if the major version is not 2, 3 or 4
     */
    public static ID3v2Header parse(byte[] bytes, int from, int available, long offset)
            throws NoSuchTagException, UnsupportedTagException {
        if (available < HEADER_LENGTH) {
            throw new NoSuchTagException("Buffer too short");
        }
        if (!TAG.equals(BufferTools.byteBufferToStringIgnoringEncodingIssues(bytes, from, TAG.length()))) {
            throw new NoSuchTagException();
        }
        int majorVersion = bytes[from + MAJOR_VERSION_OFFSET] & 0xff;
        int revision = bytes[from + MINOR_VERSION_OFFSET] & 0xff;
        if (majorVersion < 2 || majorVersion > 4) {
            throw new UnsupportedTagException("Unsupported version 2." + majorVersion + "." + revision);
        }
        byte flags = bytes[from + FLAGS_OFFSET];
        return new ID3v2Header(
                majorVersion,
                revision,
                BufferTools.checkBit(flags, UNSYNCHRONISATION_BIT),
                BufferTools.checkBit(flags, EXTENDED_HEADER_BIT),
                BufferTools.checkBit(flags, EXPERIMENTAL_BIT),
                BufferTools.checkBit(flags, FOOTER_BIT),
                BufferTools.unpackSynchsafeInteger(bytes, from + DATA_LENGTH_OFFSET),
                offset);
    }

    /** Renders this header, the size as a syncsafe integer. */
    public byte[] toBytes() {
        byte[] bytes = new byte[HEADER_LENGTH];
        BufferTools.copyIntoByteBuffer(TAG.getBytes(StandardCharsets.ISO_8859_1), 0, TAG.length(), bytes, 0);
        bytes[MAJOR_VERSION_OFFSET] = (byte) majorVersion;
        bytes[MINOR_VERSION_OFFSET] = (byte) revision;
        byte flags = 0;
        flags = BufferTools.setBit(flags, UNSYNCHRONISATION_BIT, unsynchronisation);
        flags = BufferTools.setBit(flags, EXTENDED_HEADER_BIT, extendedHeader);
        flags = BufferTools.setBit(flags, EXPERIMENTAL_BIT, experimental);
        flags = BufferTools.setBit(flags, FOOTER_BIT, footer);
        bytes[FLAGS_OFFSET] = flags;
        BufferTools.copyIntoByteBuffer(BufferTools.packSynchsafeInteger(size), 0, 4, bytes, DATA_LENGTH_OFFSET);
        return bytes;
    }

    /** Header, tag data and, for v2.4 tags that declare one, the footer. */
    public int getFullSize() {
        int fullSize = size + HEADER_LENGTH;
        if (footer) fullSize += FOOTER_LENGTH;
        return fullSize;
    }

    public int getMajorVersion() {
        return majorVersion;
    }

    public int getRevision() {
        return revision;
    }

    public boolean hasUnsynchronisation() {
        return unsynchronisation;
    }

    public boolean hasExtendedHeader() {
        return extendedHeader;
    }

    public boolean isExperimental() {
        return experimental;
    }

    public boolean hasFooter() {
        return footer;
    }

    public int getSize() {
        return size;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "ID3v2." + majorVersion + "." + revision + " (" + size + " bytes)";
    }
}
