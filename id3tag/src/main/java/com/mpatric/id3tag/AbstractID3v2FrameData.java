package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.util.Collections;
import java.util.List;

/**
 * A decoded ID3v2 frame payload. Subclasses parse the payload in their byte-array
 * constructor through {@link #unpackFrameData(byte[])} and render it again with
 * {@link #packFrameData(int)}; the frame header is handled by {@link ID3v2Tags}.
 */
public abstract class AbstractID3v2FrameData {

    protected final String id;

    protected AbstractID3v2FrameData(String id) {
        if (id == null) throw new NullPointerException("id");
        this.id = id;
    }

    /** The four-character frame ID. */
    public String getId() {
        return id;
    }

    /** The key of the slot this frame is stored under. */
    public HashKey getHashKey() {
        return HashKey.of(id);
    }

    /**
     * Renders the payload for a tag of the given major version.
     *
     * @param majorVersion 3 or 4
     * @return the frame payload, without frame header
     */
    public byte[] toBytes(int majorVersion) {
        return packFrameData(majorVersion);
    }

    /** A one-line human readable form of the frame. */
    public abstract String pprint();

    /** The frame's value(s) as text. */
    public List<String> getTextValues() {
        return Collections.singletonList(pprint());
    }

    protected abstract void unpackFrameData(byte[] bytes) throws InvalidDataException;

    protected abstract byte[] packFrameData(int majorVersion);

    protected static void write(ByteArrayOutputStream out, byte[] bytes) {
        out.write(bytes, 0, bytes.length);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (getClass() != obj.getClass()) return false;
        AbstractID3v2FrameData other = (AbstractID3v2FrameData) obj;
        return id.equals(other.id);
    }

    @Override
    public String toString() {
        return id + "=" + pprint();
    }
}
