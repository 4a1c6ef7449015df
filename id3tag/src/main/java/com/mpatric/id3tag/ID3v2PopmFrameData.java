package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * {@code POPM}: Latin-1 e-mail, rating byte and a big-endian play counter of variable
 * width. Stored under {@code POPM:<email>}.
 */
public class ID3v2PopmFrameData extends AbstractID3v2FrameData {

    public static final String ID = "POPM";

    protected String email;
    protected int rating;
    protected long count;

    public ID3v2PopmFrameData(String email, int rating, long count) {
        super(ID);
        if (rating < 0 || rating > 255) throw new IllegalArgumentException("Rating out of range: " + rating);
        this.email = email;
        this.rating = rating;
        this.count = count;
    }

    public ID3v2PopmFrameData(byte[] bytes) throws InvalidDataException {
        super(ID);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        int marker = BufferTools.indexOfTerminator(bytes, 0, bytes.length, 1);
        if (marker < 0) {
            email = TextEncoding.ISO_8859_1.decode(bytes, 0, bytes.length);
            marker = bytes.length;
        } else {
            email = TextEncoding.ISO_8859_1.decode(bytes, 0, marker);
            marker++;
        }
        rating = marker < bytes.length ? bytes[marker] & 0xff : 0;
        count = 0;
        for (int i = marker + 1; i < bytes.length; i++) {
            count = (count << 8) | (bytes[i] & 0xff);
        }
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, email.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(rating);
        if (count > 0) {
            int width = (64 - Long.numberOfLeadingZeros(count) + 7) / 8;
            write(out, BufferTools.packBitPaddedInteger(count, width, BufferTools.NORMAL_BITS));
        }
        return out.toByteArray();
    }

    @Override
    public HashKey getHashKey() {
        return HashKey.of(id, email);
    }

    public String getEmail() {
        return email;
    }

    public int getRating() {
        return rating;
    }

    public long getCount() {
        return count;
    }

    @Override
    public String pprint() {
        return email + "=" + rating + "/" + count;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + email.hashCode();
        result = prime * result + rating;
        result = prime * result + Long.hashCode(count);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2PopmFrameData other = (ID3v2PopmFrameData) obj;
        return email.equals(other.email) && rating == other.rating && count == other.count;
    }
}
