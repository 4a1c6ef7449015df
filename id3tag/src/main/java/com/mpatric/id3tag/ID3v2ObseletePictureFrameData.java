package com.mpatric.id3tag;

import java.util.Locale;

/**
 * The ID3v2.2 {@code PIC} frame: a three-character image format takes the place of the
 * MIME type. Decodes into an {@code APIC} frame and is written back as one.
 */
public class ID3v2ObseletePictureFrameData extends ID3v2PictureFrameData {

    public static final String V22_ID = "PIC";

    public ID3v2ObseletePictureFrameData(byte[] bytes) throws InvalidDataException {
        super(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        if (bytes.length < 5) throw new InvalidDataException("PIC frame too short");
        encoding = TextEncoding.fromByte(bytes[0]);
        String filetype = BufferTools.byteBufferToStringIgnoringEncodingIssues(bytes, 1, 3);
        mimeType = mimeTypeForImageFormat(filetype);
        pictureType = PictureType.fromByte(bytes[4]);
        unpackDescriptionAndImage(bytes, 5);
    }

    static String mimeTypeForImageFormat(String filetype) {
        String upper = filetype.toUpperCase(Locale.ROOT);
        if ("JPG".equals(upper)) return "image/jpeg";
        if ("PNG".equals(upper)) return "image/png";
        return "image/" + filetype.toLowerCase(Locale.ROOT);
    }
}
