package com.mpatric.id3tag;

/**
 * {@code USLT}: unsynchronised lyrics, laid out exactly like a comment. Stored under
 * {@code USLT:<description>:<language>}.
 */
public class ID3v2LyricsFrameData extends ID3v2CommentFrameData {

    public static final String ID = "USLT";

    public ID3v2LyricsFrameData(TextEncoding encoding, String language, String description, String text) {
        super(ID, encoding, language, description, text);
    }

    public ID3v2LyricsFrameData(byte[] bytes) throws InvalidDataException {
        super(ID, bytes);
    }
}
