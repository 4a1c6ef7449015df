package com.mpatric.id3tag;

/**
 * The picture type byte of an attached picture frame.
 */
public enum PictureType {
    OTHER,
    FILE_ICON,
    OTHER_FILE_ICON,
    COVER_FRONT,
    COVER_BACK,
    LEAFLET_PAGE,
    MEDIA,
    LEAD_ARTIST,
    ARTIST,
    CONDUCTOR,
    BAND,
    COMPOSER,
    LYRICIST,
    RECORDING_LOCATION,
    DURING_RECORDING,
    DURING_PERFORMANCE,
    MOVIE_CAPTURE,
    A_BRIGHT_COLOURED_FISH,
    ILLUSTRATION,
    BAND_LOGO,
    PUBLISHER_LOGO;

    private static final PictureType[] VALUES = values();

    public byte getCode() {
        return (byte) ordinal();
    }

    /** Unknown codes map to {@link #OTHER}. */
    public static PictureType fromByte(byte b) {
        int code = b & 0xff;
        if (code < VALUES.length) return VALUES[code];
        return OTHER;
    }
}
