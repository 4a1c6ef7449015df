package com.mpatric.id3tag;

import java.nio.charset.StandardCharsets;

/**
 * A frame that is decoded on first access. It starts out in one of three states:
 * <ul>
 * <li>decoded: holds the frame itself,</li>
 * <li>raw: owns the frame ID and a payload copy,</li>
 * <li>slice: holds a packed four-byte ID and a (handle, offset, length) reference into a
 * buffer owned by a {@link FrameBufferRegistry}.</li>
 * </ul>
 * Decoding a raw or slice frame replaces it in place; later calls return the same frame
 * without parsing again. Not thread-safe.
 */
public final class LazyFrame {

    private AbstractID3v2FrameData frame;
    private String id;
    private byte[] data;
    private int packedId;
    private int bufferHandle = -1;
    private int offset;
    private int length;

    private LazyFrame() {}

    public static LazyFrame decoded(AbstractID3v2FrameData frame) {
        if (frame == null) throw new NullPointerException("frame");
        LazyFrame lazyFrame = new LazyFrame();
        lazyFrame.frame = frame;
        return lazyFrame;
    }

    public static LazyFrame raw(String id, byte[] data) {
        LazyFrame lazyFrame = new LazyFrame();
        lazyFrame.id = id;
        lazyFrame.data = data;
        return lazyFrame;
    }

    /**
     * @param buffer the registered buffer, read only to pack the four ID bytes at
     *     {@code idOffset}
     */
    public static LazyFrame slice(byte[] buffer, int idOffset, int bufferHandle, int offset, int length) {
        LazyFrame lazyFrame = new LazyFrame();
        lazyFrame.packedId = (int) BufferTools.unpackInteger(buffer, idOffset);
        lazyFrame.bufferHandle = bufferHandle;
        lazyFrame.offset = offset;
        lazyFrame.length = length;
        return lazyFrame;
    }

    public boolean isDecoded() {
        return frame != null;
    }

    public boolean isSlice() {
        return frame == null && bufferHandle >= 0;
    }

    public String getFrameId() {
        if (frame != null) return frame.getId();
        if (id != null) return id;
        return new String(BufferTools.packInteger(packedId), StandardCharsets.US_ASCII);
    }

    /** @return the decoded frame, or null while undecoded */
    public AbstractID3v2FrameData getDecoded() {
        return frame;
    }

    /**
     * Decodes the frame if it has not been decoded yet.
     *
     * @param registry owner of the buffer a slice frame points into
     * @param parser codec used for the payload
     * @return the decoded frame
     * @throws InvalidDataException if the payload cannot be parsed; the frame then stays
     *     undecoded
     */
    public AbstractID3v2FrameData decode(FrameBufferRegistry registry, FrameDataParser parser) throws InvalidDataException {
        if (frame != null) return frame;
        if (bufferHandle >= 0) {
            frame = parser.parse(getFrameId(), registry.get(bufferHandle), offset, length);
        } else {
            frame = parser.parse(id, data, 0, data.length);
        }
        id = null;
        data = null;
        bufferHandle = -1;
        return frame;
    }

    /**
     * The payload to write for this frame: the undecoded bytes verbatim, or the decoded
     * frame rendered for {@code majorVersion}.
     */
    byte[] payload(FrameBufferRegistry registry, int majorVersion) {
        if (frame != null) return frame.toBytes(majorVersion);
        if (bufferHandle >= 0) return BufferTools.copyBuffer(registry.get(bufferHandle), offset, length);
        return data;
    }
}
