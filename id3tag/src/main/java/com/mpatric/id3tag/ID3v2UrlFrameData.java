package com.mpatric.id3tag;

import java.nio.charset.StandardCharsets;

/**
 * A URL link frame ({@code W***} except {@code WXXX}). The payload is an unprefixed
 * Latin-1 URL.
 */
public class ID3v2UrlFrameData extends AbstractID3v2FrameData {

    protected String url;

    public ID3v2UrlFrameData(String id, String url) {
        super(id);
        this.url = url;
    }

    public ID3v2UrlFrameData(String id, byte[] bytes) throws InvalidDataException {
        super(id);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        url = trimNulls(TextEncoding.ISO_8859_1.decode(bytes, 0, bytes.length));
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        return url.getBytes(StandardCharsets.ISO_8859_1);
    }

    static String trimNulls(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '\0') {
            end--;
        }
        return s.substring(0, end);
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    @Override
    public String pprint() {
        return url;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + url.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        return url.equals(((ID3v2UrlFrameData) obj).url);
    }
}
