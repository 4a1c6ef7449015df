package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * {@code WXXX}: an encoded description followed by a Latin-1 URL. Stored under
 * {@code WXXX:<description>}.
 */
public class ID3v2UserUrlFrameData extends AbstractID3v2FrameData {

    public static final String ID = "WXXX";

    protected TextEncoding encoding;
    protected String description;
    protected String url;

    public ID3v2UserUrlFrameData(TextEncoding encoding, String description, String url) {
        super(ID);
        this.encoding = encoding;
        this.description = description;
        this.url = url;
    }

    public ID3v2UserUrlFrameData(byte[] bytes) throws InvalidDataException {
        super(ID);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        if (bytes.length == 0) throw new InvalidDataException("Empty WXXX frame");
        encoding = TextEncoding.fromByte(bytes[0]);
        int marker = encoding.indexOfTerminator(bytes, 1, bytes.length);
        if (marker < 0) {
            description = encoding.decode(bytes, 1, bytes.length - 1);
            url = "";
            return;
        }
        description = encoding.decode(bytes, 1, marker - 1);
        marker += encoding.getTerminatorLength();
        url = ID3v2UrlFrameData.trimNulls(
                TextEncoding.ISO_8859_1.decode(bytes, marker, bytes.length - marker));
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        TextEncoding writeEncoding = encoding.forWriting(majorVersion);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(writeEncoding.getCode());
        write(out, writeEncoding.encode(description));
        write(out, writeEncoding.getTerminator());
        write(out, url.getBytes(StandardCharsets.ISO_8859_1));
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

    public String getUrl() {
        return url;
    }

    @Override
    public String pprint() {
        return description + "=" + url;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + encoding.hashCode();
        result = prime * result + description.hashCode();
        result = prime * result + url.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2UserUrlFrameData other = (ID3v2UserUrlFrameData) obj;
        return encoding == other.encoding
                && description.equals(other.description)
                && url.equals(other.url);
    }
}
