package com.mpatric.id3tag;

import java.util.ArrayList;
import java.util.List;

/**
 * The 128-byte legacy tag at the end of a file, including the ID3v1.1 track number.
 */
public class ID3v1Tag {

    public static final int TAG_LENGTH = 128;
    public static final String TAG = "TAG";
    public static final String COMMENT_DESCRIPTION = "ID3v1 Comment";
    public static final String COMMENT_LANGUAGE = "eng";
    public static final int NO_GENRE = 255;

    private static final int TITLE_OFFSET = 3;
    private static final int TITLE_LENGTH = 30;
    private static final int ARTIST_OFFSET = 33;
    private static final int ARTIST_LENGTH = 30;
    private static final int ALBUM_OFFSET = 63;
    private static final int ALBUM_LENGTH = 30;
    private static final int YEAR_OFFSET = 93;
    private static final int YEAR_LENGTH = 4;
    private static final int COMMENT_OFFSET = 97;
    private static final int COMMENT_LENGTH_V1_0 = 30;
    private static final int COMMENT_LENGTH_V1_1 = 28;
    private static final int TRACK_MARKER_OFFSET = 125;
    private static final int TRACK_OFFSET = 126;
    private static final int GENRE_OFFSET = 127;

    private String title = "";
    private String artist = "";
    private String album = "";
    private String year = "";
    private String comment = "";
    private int track = 0;
    private int genre = NO_GENRE;

    public ID3v1Tag() {
    }

    /**
     * @param bytes either exactly one 128-byte tag block, or a buffer whose last 128 bytes
     *     are examined
     * @throws NoSuchTagException if there is no {@code "TAG"} block
     */
    public ID3v1Tag(byte[] bytes) throws NoSuchTagException {
        int offset = find(bytes);
        if (offset < 0) throw new NoSuchTagException();
        unpackTag(bytes, offset);
    }

    /** @return the offset of a trailing tag block in {@code bytes}, or -1 */
    public static int find(byte[] bytes) {
        if (bytes.length < TAG_LENGTH) return -1;
        int offset = bytes.length - TAG_LENGTH;
        if (!TAG.equals(BufferTools.byteBufferToStringIgnoringEncodingIssues(bytes, offset, TAG.length()))) {
            return -1;
        }
        return offset;
    }

    public static boolean hasTag(byte[] bytes) {
        return find(bytes) >= 0;
    }

    private void unpackTag(byte[] bytes, int offset) {
        title = BufferTools.fixedWidthFieldToString(bytes, offset + TITLE_OFFSET, TITLE_LENGTH);
        artist = BufferTools.fixedWidthFieldToString(bytes, offset + ARTIST_OFFSET, ARTIST_LENGTH);
        album = BufferTools.fixedWidthFieldToString(bytes, offset + ALBUM_OFFSET, ALBUM_LENGTH);
        year = BufferTools.fixedWidthFieldToString(bytes, offset + YEAR_OFFSET, YEAR_LENGTH);
        if (bytes[offset + TRACK_MARKER_OFFSET] == 0 && bytes[offset + TRACK_OFFSET] != 0) {
            comment = BufferTools.fixedWidthFieldToString(bytes, offset + COMMENT_OFFSET, COMMENT_LENGTH_V1_1);
            track = bytes[offset + TRACK_OFFSET] & 0xff;
        } else {
            comment = BufferTools.fixedWidthFieldToString(bytes, offset + COMMENT_OFFSET, COMMENT_LENGTH_V1_0);
            track = 0;
        }
        genre = bytes[offset + GENRE_OFFSET] & 0xff;
    }

    /**
     * Maps the non-empty fields onto their ID3v2 equivalents: {@code TIT2}, {@code TPE1},
     * {@code TALB}, {@code TDRC}, {@code COMM}, {@code TRCK} and {@code TCON}. A genre
     * index outside the genre table produces no frame.
     */
    public List<AbstractID3v2FrameData> toFrames() {
        List<AbstractID3v2FrameData> frames = new ArrayList<>();
        addText(frames, "TIT2", title);
        addText(frames, "TPE1", artist);
        addText(frames, "TALB", album);
        addText(frames, "TDRC", year);
        if (!comment.isEmpty()) {
            frames.add(new ID3v2CommentFrameData(TextEncoding.ISO_8859_1, COMMENT_LANGUAGE, COMMENT_DESCRIPTION, comment));
        }
        if (track > 0) {
            addText(frames, "TRCK", Integer.toString(track));
        }
        String genreName = ID3v1Genres.getGenreName(genre);
        if (genreName != null) {
            addText(frames, "TCON", genreName);
        }
        return frames;
    }

    private static void addText(List<AbstractID3v2FrameData> frames, String id, String value) {
        if (value.isEmpty()) return;
        frames.add(new ID3v2TextFrameData(id, TextEncoding.ISO_8859_1, value));
    }

    /**
     * Builds a legacy tag from the decoded values of an ID3v2 container. Values longer than
     * their field are truncated when rendered.
     */
    public static ID3v1Tag fromTags(ID3v2Tags tags) {
        ID3v1Tag tag = new ID3v1Tag();
        tag.title = firstText(tags, "TIT2");
        tag.artist = firstText(tags, "TPE1");
        tag.album = firstText(tags, "TALB");
        tag.year = firstText(tags, "TDRC");
        if (tag.year.isEmpty()) tag.year = firstText(tags, "TYER");
        tag.comment = firstComment(tags);
        tag.track = parseTrack(firstText(tags, "TRCK"));
        String genreText = firstText(tags, "TCON");
        if (!genreText.isEmpty()) {
            List<String> genres = ID3v1Genres.parseGenre(genreText);
            int index = genres.isEmpty() ? -1 : ID3v1Genres.indexOf(genres.get(0));
            tag.genre = index >= 0 ? index : NO_GENRE;
        }
        return tag;
    }

    private static String firstText(ID3v2Tags tags, String id) {
        AbstractID3v2FrameData frame = tags.getDecoded(id);
        if (frame instanceof ID3v2TextFrameData) {
            List<String> text = ((ID3v2TextFrameData) frame).getText();
            if (!text.isEmpty()) return text.get(0);
        }
        return "";
    }

    private static String firstComment(ID3v2Tags tags) {
        for (HashKey key : tags.hashKeys()) {
            if (!ID3v2CommentFrameData.ID.equals(key.getFrameId())) continue;
            AbstractID3v2FrameData frame = tags.getDecoded(key);
            if (frame instanceof ID3v2CommentFrameData) {
                return ((ID3v2CommentFrameData) frame).getText();
            }
        }
        return "";
    }

    static int parseTrack(String text) {
        int slash = text.indexOf('/');
        String number = (slash >= 0 ? text.substring(0, slash) : text).trim();
        try {
            int track = Integer.parseInt(number);
            return track >= 1 && track <= 255 ? track : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public byte[] toBytes() {
        byte[] bytes = new byte[TAG_LENGTH];
        BufferTools.stringIntoFixedWidthField(TAG, bytes, 0, TAG.length());
        BufferTools.stringIntoFixedWidthField(title, bytes, TITLE_OFFSET, TITLE_LENGTH);
        BufferTools.stringIntoFixedWidthField(artist, bytes, ARTIST_OFFSET, ARTIST_LENGTH);
        BufferTools.stringIntoFixedWidthField(album, bytes, ALBUM_OFFSET, ALBUM_LENGTH);
        BufferTools.stringIntoFixedWidthField(year, bytes, YEAR_OFFSET, YEAR_LENGTH);
        if (track > 0) {
            BufferTools.stringIntoFixedWidthField(comment, bytes, COMMENT_OFFSET, COMMENT_LENGTH_V1_1);
            bytes[TRACK_MARKER_OFFSET] = 0;
            bytes[TRACK_OFFSET] = (byte) track;
        } else {
            BufferTools.stringIntoFixedWidthField(comment, bytes, COMMENT_OFFSET, COMMENT_LENGTH_V1_0);
        }
        bytes[GENRE_OFFSET] = (byte) genre;
        return bytes;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getArtist() {
        return artist;
    }

    public void setArtist(String artist) {
        this.artist = artist;
    }

    public String getAlbum() {
        return album;
    }

    public void setAlbum(String album) {
        this.album = album;
    }

    public String getYear() {
        return year;
    }

    public void setYear(String year) {
        this.year = year;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /** @return the ID3v1.1 track number, 0 if absent */
    public int getTrack() {
        return track;
    }

    public void setTrack(int track) {
        if (track < 0 || track > 255) throw new IllegalArgumentException("Track out of range: " + track);
        this.track = track;
    }

    public int getGenre() {
        return genre;
    }

    public void setGenre(int genre) {
        if (genre < 0 || genre > 255) throw new IllegalArgumentException("Genre out of range: " + genre);
        this.genre = genre;
    }

    public String getGenreDescription() {
        return ID3v1Genres.getGenreName(genre);
    }

    public String getVersion() {
        return track > 0 ? "1" : "0";
    }
}
