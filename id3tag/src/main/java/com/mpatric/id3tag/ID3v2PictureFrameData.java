package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * {@code APIC}: encoding byte, Latin-1 MIME type, picture type byte, encoded description
 * and the image bytes. Stored under {@code APIC:<description>}.
 */
public class ID3v2PictureFrameData extends AbstractID3v2FrameData {

    public static final String ID = "APIC";

    protected TextEncoding encoding;
    protected String mimeType;
    protected PictureType pictureType;
    protected String description;
    protected byte[] imageData;

    public ID3v2PictureFrameData(TextEncoding encoding, String mimeType, PictureType pictureType, String description, byte[] imageData) {
        super(ID);
        this.encoding = encoding;
        this.mimeType = mimeType;
        this.pictureType = pictureType;
        this.description = description;
        this.imageData = imageData;
    }

    public ID3v2PictureFrameData(byte[] bytes) throws InvalidDataException {
        super(ID);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        if (bytes.length == 0) throw new InvalidDataException("Empty APIC frame");
        encoding = TextEncoding.fromByte(bytes[0]);
        int marker = BufferTools.indexOfTerminator(bytes, 1, bytes.length, 1);
        if (marker < 0 || marker + 1 >= bytes.length) {
            throw new InvalidDataException("APIC frame too short");
        }
        mimeType = TextEncoding.ISO_8859_1.decode(bytes, 1, marker - 1);
        pictureType = PictureType.fromByte(bytes[marker + 1]);
        unpackDescriptionAndImage(bytes, marker + 2);
    }

    protected void unpackDescriptionAndImage(byte[] bytes, int offset) {
        int marker = encoding.indexOfTerminator(bytes, offset, bytes.length);
        if (marker >= 0) {
            description = encoding.decode(bytes, offset, marker - offset);
            marker += encoding.getTerminatorLength();
        } else {
            description = encoding.decode(bytes, offset, bytes.length - offset);
            marker = bytes.length;
        }
        imageData = BufferTools.copyBuffer(bytes, marker, bytes.length - marker);
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        TextEncoding writeEncoding = encoding.forWriting(majorVersion);
        ByteArrayOutputStream out = new ByteArrayOutputStream(imageData.length + 64);
        out.write(writeEncoding.getCode());
        write(out, mimeType.getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(pictureType.getCode());
        write(out, writeEncoding.encode(description));
        write(out, writeEncoding.getTerminator());
        write(out, imageData);
        return out.toByteArray();
    }

    @Override
    public HashKey getHashKey() {
        return HashKey.of(id, description);
    }

    public TextEncoding getEncoding() {
        return encoding;
    }

    public String getMimeType() {
        return mimeType;
    }

    public PictureType getPictureType() {
        return pictureType;
    }

    public String getDescription() {
        return description;
    }

    public byte[] getImageData() {
        return imageData;
    }

    @Override
    public String pprint() {
        return description + " (" + mimeType + ", " + imageData.length + " bytes)";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + encoding.hashCode();
        result = prime * result + mimeType.hashCode();
        result = prime * result + pictureType.hashCode();
        result = prime * result + description.hashCode();
        result = prime * result + Arrays.hashCode(imageData);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2PictureFrameData other = (ID3v2PictureFrameData) obj;
        return encoding == other.encoding
                && mimeType.equals(other.mimeType)
                && pictureType == other.pictureType
                && description.equals(other.description)
                && Arrays.equals(imageData, other.imageData);
    }
}
