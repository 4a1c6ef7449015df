package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code TXXX}: a text frame qualified by a description. Stored under
 * {@code TXXX:<description>}.
 */
public class ID3v2UserTextFrameData extends AbstractID3v2FrameData {

    public static final String ID = "TXXX";

    protected TextEncoding encoding;
    protected String description;
    protected List<String> text;

    public ID3v2UserTextFrameData(TextEncoding encoding, String description, List<String> text) {
        super(ID);
        this.encoding = encoding;
        this.description = description;
        this.text = new ArrayList<>(text);
    }

    public ID3v2UserTextFrameData(byte[] bytes) throws InvalidDataException {
        super(ID);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        if (bytes.length == 0) throw new InvalidDataException("Empty TXXX frame");
        encoding = TextEncoding.fromByte(bytes[0]);
        int marker = encoding.indexOfTerminator(bytes, 1, bytes.length);
        if (marker < 0) {
            description = encoding.decode(bytes, 1, bytes.length - 1);
            text = new ArrayList<>();
            return;
        }
        description = encoding.decode(bytes, 1, marker - 1);
        marker += encoding.getTerminatorLength();
        text = encoding.decodeList(bytes, marker, bytes.length - marker);
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        TextEncoding writeEncoding = encoding.forWriting(majorVersion);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(writeEncoding.getCode());
        write(out, writeEncoding.encode(description));
        write(out, writeEncoding.getTerminator());
        write(out, writeEncoding.encodeList(text));
        return out.toByteArray();
    }

    @Override
    public HashKey getHashKey() {
        return HashKey.of(id, description);
    }

    public TextEncoding getEncoding() {
        return encoding;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getText() {
        return text;
    }

    public void setText(List<String> text) {
        this.text = new ArrayList<>(text);
    }

    @Override
    public String pprint() {
        return description + "=" + String.join("/", text);
    }

    @Override
    public List<String> getTextValues() {
        return Collections.unmodifiableList(text);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + encoding.hashCode();
        result = prime * result + description.hashCode();
        result = prime * result + text.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2UserTextFrameData other = (ID3v2UserTextFrameData) obj;
        return encoding == other.encoding
                && description.equals(other.description)
                && text.equals(other.text);
    }
}
