package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A text information frame ({@code T***} except {@code TXXX}): an encoding byte followed
 * by one or more terminator-separated values.
 */
public class ID3v2TextFrameData extends AbstractID3v2FrameData {

    protected TextEncoding encoding;
    protected List<String> text;

    public ID3v2TextFrameData(String id, TextEncoding encoding, List<String> text) {
        super(id);
        this.encoding = encoding;
        this.text = new ArrayList<>(text);
    }

    public ID3v2TextFrameData(String id, TextEncoding encoding, String text) {
        this(id, encoding, Collections.singletonList(text));
    }

    public ID3v2TextFrameData(String id, byte[] bytes) throws InvalidDataException {
        super(id);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        if (bytes.length == 0) {
            encoding = TextEncoding.ISO_8859_1;
            text = new ArrayList<>();
            return;
        }
        encoding = TextEncoding.fromByte(bytes[0]);
        text = encoding.decodeList(bytes, 1, bytes.length - 1);
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        TextEncoding writeEncoding = encoding.forWriting(majorVersion);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(writeEncoding.getCode());
        write(out, writeEncoding.encodeList(text));
        return out.toByteArray();
    }

    public TextEncoding getEncoding() {
        return encoding;
    }

    public void setEncoding(TextEncoding encoding) {
        this.encoding = encoding;
    }

    public List<String> getText() {
        return text;
    }

    public void setText(List<String> text) {
        this.text = new ArrayList<>(text);
    }

    @Override
    public String pprint() {
        return String.join("/", text);
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
        result = prime * result + text.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2TextFrameData other = (ID3v2TextFrameData) obj;
        return encoding == other.encoding && text.equals(other.text);
    }
}
