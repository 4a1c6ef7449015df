package com.mpatric.id3tag;

/**
 * Turns a frame payload into a frame. {@link ID3v2Tags} decodes its lazily stored frames
 * through this interface; {@link ID3v2FrameFactory#DEFAULT_PARSER} is the standard codec.
 */
public interface FrameDataParser {

    /**
     * @param id four-character frame ID
     * @param bytes buffer holding the payload
     * @param offset start of the payload in {@code bytes}
     * @param length payload length
     * @return the decoded frame
     * @throws InvalidDataException if the payload is malformed
     */
    AbstractID3v2FrameData parse(String id, byte[] bytes, int offset, int length) throws InvalidDataException;
}
