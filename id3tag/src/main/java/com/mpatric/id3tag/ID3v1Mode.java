package com.mpatric.id3tag;

/** What {@link ID3File#save} does with the trailing ID3v1 tag. */
public enum ID3v1Mode {
    /** Leave the trailing bytes as they are. */
    KEEP,
    /** Strip an existing ID3v1 tag. */
    REMOVE,
    /** Rewrite an existing ID3v1 tag from the saved frames; add none if there was none. */
    UPDATE,
    /** Write an ID3v1 tag from the saved frames, replacing any existing one. */
    CREATE
}
