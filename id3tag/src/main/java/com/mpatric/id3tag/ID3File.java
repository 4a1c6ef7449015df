package com.mpatric.id3tag;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A file carrying ID3 tags. Loading reads the ID3v2 header, the tag region it declares and
 * the last 128 bytes; the audio data is never read. Saving and deleting rewrite the file in
 * place, copying everything after the old ID3v2 tag byte for byte.
 */
public class ID3File extends FileWrapper {

    private static final Logger log = LoggerFactory.getLogger(ID3File.class);

    private final FrameDataParser parser;
    private ID3v2Tags tags;
    private ID3v2Header header;
    private ID3v1Tag id3v1Tag;

    public ID3File(String filename) throws IOException, UnsupportedTagException {
        this(Paths.get(filename));
    }

    public ID3File(Path path) throws IOException, UnsupportedTagException {
        this(path, ID3v2FrameFactory.DEFAULT_PARSER);
    }

    /**
     * @throws UnsupportedTagException if the file starts with an ID3v2 header of a version
     *     other than 2.2, 2.3 or 2.4
     */
    public ID3File(Path path, FrameDataParser parser) throws IOException, UnsupportedTagException {
        super(path);
        this.parser = parser;
        load();
    }

    private void load() throws IOException, UnsupportedTagException {
        tags = new ID3v2Tags(parser);
        RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "r");
        try {
            long fileLength = randomAccessFile.length();
            byte[] headerBytes = new byte[ID3v2Header.HEADER_LENGTH];
            int headerLength = (int) Math.min(ID3v2Header.HEADER_LENGTH, fileLength);
            randomAccessFile.readFully(headerBytes, 0, headerLength);
            header = ID3TagLoader.readHeader(headerBytes, headerLength);
            if (header != null) {
                int tagLength = (int) Math.min(header.getSize(), fileLength - ID3v2Header.HEADER_LENGTH);
                if (tagLength < header.getSize()) {
                    log.debug("{}: tag declares {} bytes but the file holds {}", path, header.getSize(), tagLength);
                }
                byte[] tagData = new byte[tagLength];
                randomAccessFile.readFully(tagData);
                ID3TagLoader.readTag(tags, header, tagData);
            }
            id3v1Tag = null;
            if (fileLength >= ID3v1Tag.TAG_LENGTH) {
                byte[] trailer = new byte[ID3v1Tag.TAG_LENGTH];
                randomAccessFile.seek(fileLength - ID3v1Tag.TAG_LENGTH);
                randomAccessFile.readFully(trailer);
                id3v1Tag = ID3TagLoader.readId3v1Tag(trailer);
                ID3TagLoader.mergeId3v1Tag(tags, id3v1Tag);
            }
        } finally {
            randomAccessFile.close();
        }
    }

    public ID3v2Tags getTags() {
        return tags;
    }

    /** @return the header of the ID3v2 tag the file was loaded with, or null */
    public ID3v2Header getHeader() {
        return header;
    }

    public ID3v1Tag getId3v1Tag() {
        return id3v1Tag;
    }

    public boolean hasId3v2Tag() {
        return header != null;
    }

    public boolean hasId3v1Tag() {
        return id3v1Tag != null;
    }

    public void save() throws IOException {
        save(ID3v2TagWriter.DEFAULT_VERSION, ID3v2TagWriter.DEFAULT_PADDING, ID3v1Mode.KEEP);
    }

    public void save(int majorVersion) throws IOException {
        save(majorVersion, ID3v2TagWriter.DEFAULT_PADDING, ID3v1Mode.KEEP);
    }

    /**
     * Writes this file's frames as a new ID3v2 tag in place of the old one.
     *
     * @param majorVersion 3 or 4
     * @param padding zero bytes after the frames
     * @param id3v1Mode what to do with the trailing ID3v1 tag
     * @throws IllegalArgumentException for an unsupported version; the file is left untouched
     */
    public void save(int majorVersion, int padding, ID3v1Mode id3v1Mode) throws IOException {
        byte[] newTag = ID3v2TagWriter.render(tags, majorVersion, padding);
        byte[] newId3v1Tag = writeTags(path, newTag, tags, id3v1Mode);
        header = new ID3v2Header(majorVersion, 0, false, false, false, false,
                newTag.length - ID3v2Header.HEADER_LENGTH, 0);
        if (newId3v1Tag != null) {
            id3v1Tag = ID3TagLoader.readId3v1Tag(newId3v1Tag);
        } else if (id3v1Mode == ID3v1Mode.REMOVE) {
            id3v1Tag = null;
        }
        refresh();
    }

    /**
     * Removes the ID3v2 tag and a trailing ID3v1 tag. Does nothing to the file if it has
     * neither. The in-memory tags are cleared.
     */
    public void delete() throws IOException {
        boolean changed = deleteTags(path);
        tags = new ID3v2Tags(parser);
        header = null;
        id3v1Tag = null;
        if (changed) refresh();
    }

    /** @return the ID3v1 block written at the end, or null if none was written */
    private static byte[] writeTags(Path path, byte[] newTag, ID3v2Tags tags, ID3v1Mode id3v1Mode) throws IOException {
        byte[] existing = Files.readAllBytes(path);
        int audioStart = oldTagSize(existing);
        int audioEnd = existing.length;
        boolean trailingTag = hasTrailingId3v1Tag(existing, audioStart);
        byte[] newId3v1Tag = null;
        switch (id3v1Mode) {
            case REMOVE:
                if (trailingTag) audioEnd -= ID3v1Tag.TAG_LENGTH;
                break;
            case UPDATE:
                if (trailingTag) {
                    audioEnd -= ID3v1Tag.TAG_LENGTH;
                    newId3v1Tag = ID3v1Tag.fromTags(tags).toBytes();
                }
                break;
            case CREATE:
                if (trailingTag) audioEnd -= ID3v1Tag.TAG_LENGTH;
                newId3v1Tag = ID3v1Tag.fromTags(tags).toBytes();
                break;
            default:
                break;
        }

        RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "rw");
        try {
            randomAccessFile.seek(0);
            randomAccessFile.write(newTag);
            randomAccessFile.write(existing, audioStart, audioEnd - audioStart);
            if (newId3v1Tag != null) {
                randomAccessFile.write(newId3v1Tag);
            }
            randomAccessFile.setLength(randomAccessFile.getFilePointer());
        } finally {
            randomAccessFile.close();
        }
        return newId3v1Tag;
    }

    /** @return whether the file was rewritten */
    private static boolean deleteTags(Path path) throws IOException {
        byte[] existing = Files.readAllBytes(path);
        int audioStart = oldTagSize(existing);
        int audioEnd = existing.length;
        if (hasTrailingId3v1Tag(existing, audioStart)) audioEnd -= ID3v1Tag.TAG_LENGTH;
        if (audioStart == 0 && audioEnd == existing.length) return false;

        RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "rw");
        try {
            randomAccessFile.seek(0);
            randomAccessFile.write(existing, audioStart, audioEnd - audioStart);
            randomAccessFile.setLength(audioEnd - audioStart);
        } finally {
            randomAccessFile.close();
        }
        return true;
    }

    /**
     * Full size of the ID3v2 tag at the start of {@code bytes}, or 0 if there is no tag
     * this library can read.
     */
    static int oldTagSize(byte[] bytes) {
        try {
            ID3v2Header oldHeader = ID3v2Header.parse(bytes, 0);
            return (int) Math.min(oldHeader.getFullSize(), bytes.length);
        } catch (NoSuchTagException e) {
            return 0;
        } catch (UnsupportedTagException e) {
            log.debug("Overwriting unreadable tag: {}", e.getMessage());
            return 0;
        }
    }

    private static boolean hasTrailingId3v1Tag(byte[] bytes, int audioStart) {
        int offset = ID3v1Tag.find(bytes);
        return offset >= 0 && offset >= audioStart;
    }

    public static LoadedTag load(Path path) throws IOException, UnsupportedTagException {
        ID3File file = new ID3File(path);
        return new LoadedTag(file.getTags(), file.getHeader(), file.getId3v1Tag());
    }

    /** Writes {@code tags} into the file at {@code path}, keeping its audio data and ID3v1 tag. */
    public static void save(Path path, ID3v2Tags tags, int majorVersion) throws IOException {
        writeTags(path, ID3v2TagWriter.render(tags, majorVersion), tags, ID3v1Mode.KEEP);
    }

    public static void delete(Path path) throws IOException {
        deleteTags(path);
    }
}
