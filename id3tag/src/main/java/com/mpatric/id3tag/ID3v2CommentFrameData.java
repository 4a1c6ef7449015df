package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * {@code COMM}: encoding byte, three-byte language code, terminated description and the
 * comment text. Stored under {@code COMM:<description>:<language>}.
 */
public class ID3v2CommentFrameData extends AbstractID3v2FrameData {

    public static final String ID = "COMM";
    static final String UNKNOWN_LANGUAGE = "XXX";

    protected TextEncoding encoding;
    protected String language;
    protected String description;
    protected String text;

    public ID3v2CommentFrameData(TextEncoding encoding, String language, String description, String text) {
        this(ID, encoding, language, description, text);
    }

    protected ID3v2CommentFrameData(String id, TextEncoding encoding, String language, String description, String text) {
        super(id);
        this.encoding = encoding;
        this.language = language;
        this.description = description;
        this.text = text;
    }

    public ID3v2CommentFrameData(byte[] bytes) throws InvalidDataException {
        this(ID, bytes);
    }

    protected ID3v2CommentFrameData(String id, byte[] bytes) throws InvalidDataException {
        super(id);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        if (bytes.length < 4) throw new InvalidDataException(id + " frame too short");
        encoding = TextEncoding.fromByte(bytes[0]);
        language = readLanguage(bytes, 1);
        int marker = encoding.indexOfTerminator(bytes, 4, bytes.length);
        if (marker < 0) {
            description = encoding.decode(bytes, 4, bytes.length - 4);
            text = "";
            return;
        }
        description = encoding.decode(bytes, 4, marker - 4);
        marker += encoding.getTerminatorLength();
        text = ID3v2UrlFrameData.trimNulls(encoding.decode(bytes, marker, bytes.length - marker));
    }

    static String readLanguage(byte[] bytes, int offset) {
        for (int i = offset; i < offset + 3; i++) {
            if ((bytes[i] & 0x80) != 0) return UNKNOWN_LANGUAGE;
        }
        return new String(bytes, offset, 3, StandardCharsets.US_ASCII);
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        TextEncoding writeEncoding = encoding.forWriting(majorVersion);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(writeEncoding.getCode());
        byte[] languageBytes = language.getBytes(StandardCharsets.ISO_8859_1);
        if (languageBytes.length < 3) {
            languageBytes = UNKNOWN_LANGUAGE.getBytes(StandardCharsets.ISO_8859_1);
        }
        out.write(languageBytes, 0, 3);
        write(out, writeEncoding.encode(description));
        write(out, writeEncoding.getTerminator());
        write(out, writeEncoding.encode(text));
        return out.toByteArray();
    }

    @Override
    public HashKey getHashKey() {
        return HashKey.of(id, description, language);
    }

    public TextEncoding getEncoding() {
        return encoding;
    }

    public String getLanguage() {
        return language;
    }

    public String getDescription() {
        return description;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public String pprint() {
        return text;
    }

    @Override
    public List<String> getTextValues() {
        return Collections.singletonList(text);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + encoding.hashCode();
        result = prime * result + language.hashCode();
        result = prime * result + description.hashCode();
        result = prime * result + text.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2CommentFrameData other = (ID3v2CommentFrameData) obj;
        return encoding == other.encoding
                && language.equals(other.language)
                && description.equals(other.description)
                && text.equals(other.text);
    }
}
