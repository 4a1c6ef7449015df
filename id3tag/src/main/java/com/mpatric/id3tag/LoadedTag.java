package com.mpatric.id3tag;

/**
 * Result of loading tags: the frame container, the ID3v2 header it was read from (null
 * when there was no ID3v2 tag) and the trailing ID3v1 tag, if any. Frames of the ID3v1 tag
 * are already merged into the container wherever the ID3v2 tag had no frame with the same key.
 */
public final class LoadedTag {

    private final ID3v2Tags tags;
    private final ID3v2Header header;
    private final ID3v1Tag id3v1Tag;

    LoadedTag(ID3v2Tags tags, ID3v2Header header, ID3v1Tag id3v1Tag) {
        this.tags = tags;
        this.header = header;
        this.id3v1Tag = id3v1Tag;
    }

    public ID3v2Tags getTags() {
        return tags;
    }

    public ID3v2Header getHeader() {
        return header;
    }

    public ID3v1Tag getId3v1Tag() {
        return id3v1Tag;
    }

    public boolean hasId3v2Tag() {
        return header != null;
    }

    public boolean hasId3v1Tag() {
        return id3v1Tag != null;
    }
}
