package com.mpatric.id3tag;

/**
 * A frame the tag engine cannot interpret (encrypted, undecompressible or, for ID3v2.2,
 * of an unmapped ID). The payload is kept exactly as stored.
 */
public final class UnknownFrame {

    private final String id;
    private final byte[] data;

    public UnknownFrame(String id, byte[] data) {
        this.id = id;
        this.data = data;
    }

    public String getId() {
        return id;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public String toString() {
        return id + " [" + data.length + " bytes]";
    }
}
