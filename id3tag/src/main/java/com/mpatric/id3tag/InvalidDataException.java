package com.mpatric.id3tag;

/**
 * Thrown when a structural field of a tag or frame is malformed, for example a
 * truncated picture block or an unknown text encoding byte.
 */
public class InvalidDataException extends BaseException {

    private static final long serialVersionUID = 1L;

    public InvalidDataException() {
        super();
    }

    public InvalidDataException(String message) {
        super(message);
    }

    public InvalidDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
