package com.mpatric.id3tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads tags from an in-memory copy of a file. {@link ID3File} shares the steps used here
 * but reads only the header, the tag region and the last 128 bytes from disk.
 */
public final class ID3TagLoader {

    private static final Logger log = LoggerFactory.getLogger(ID3TagLoader.class);

    private ID3TagLoader() {}

    public static LoadedTag load(byte[] bytes) throws UnsupportedTagException {
        return load(bytes, ID3v2FrameFactory.DEFAULT_PARSER);
    }

    /**
     * @param bytes the complete file content
     * @param parser codec used when frames are decoded on access
     * @return the tags; a file without any tag yields an empty container
     * @throws UnsupportedTagException if an ID3v2 header declares a version other than 2.2, 2.3 or 2.4
     */
    public static LoadedTag load(byte[] bytes, FrameDataParser parser) throws UnsupportedTagException {
        ID3v2Tags tags = new ID3v2Tags(parser);
        ID3v2Header header = readHeader(bytes, bytes.length);
        if (header != null) {
            int end = (int) Math.min((long) ID3v2Header.HEADER_LENGTH + header.getSize(), bytes.length);
            if (end - ID3v2Header.HEADER_LENGTH < header.getSize()) {
                log.debug("Tag declares {} bytes but only {} are present", header.getSize(), end - ID3v2Header.HEADER_LENGTH);
            }
            readTag(tags, header, BufferTools.copyBuffer(bytes, ID3v2Header.HEADER_LENGTH, end - ID3v2Header.HEADER_LENGTH));
        }
        ID3v1Tag id3v1Tag = readId3v1Tag(bytes);
        mergeId3v1Tag(tags, id3v1Tag);
        return new LoadedTag(tags, header, id3v1Tag);
    }

    /** @return the header at the start of {@code bytes}, or null if there is none */
    static ID3v2Header readHeader(byte[] bytes, int available) throws UnsupportedTagException {
        try {
            return ID3v2Header.parse(bytes, 0, available, 0);
        } catch (NoSuchTagException e) {
            return null;
        }
    }

    /**
     * Undoes whole-tag unsynchronisation for tags before v2.4 and reads the frames.
     */
    static void readTag(ID3v2Tags tags, ID3v2Header header, byte[] tagData) {
        if (header.hasUnsynchronisation() && header.getMajorVersion() < 4) {
            tagData = BufferTools.synchroniseBuffer(tagData);
        }
        tags.readFrames(tagData, header);
    }

    /** @return the ID3v1 tag in the last 128 bytes, or null if there is none */
    static ID3v1Tag readId3v1Tag(byte[] bytes) {
        try {
            return new ID3v1Tag(bytes);
        } catch (NoSuchTagException e) {
            return null;
        }
    }

    /** Adds the ID3v1 frames whose keys the container does not have yet. */
    static void mergeId3v1Tag(ID3v2Tags tags, ID3v1Tag id3v1Tag) {
        if (id3v1Tag == null) return;
        for (AbstractID3v2FrameData frame : id3v1Tag.toFrames()) {
            if (!tags.containsKey(frame.getHashKey())) {
                tags.add(frame);
            }
        }
    }
}
