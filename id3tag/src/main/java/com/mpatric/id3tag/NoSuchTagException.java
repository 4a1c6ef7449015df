package com.mpatric.id3tag;

/**
 * Thrown when a buffer does not start with an ID3v2 header (missing or truncated
 * {@code "ID3"} magic). Loaders treat this as "no ID3v2 tag" and fall back to ID3v1.
 */
public class NoSuchTagException extends BaseException {

    private static final long serialVersionUID = 1L;

    public NoSuchTagException() {
        super();
    }

    public NoSuchTagException(String message) {
        super(message);
    }

    public NoSuchTagException(String message, Throwable cause) {
        super(message, cause);
    }
}
