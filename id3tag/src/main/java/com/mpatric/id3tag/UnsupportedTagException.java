package com.mpatric.id3tag;

/**
 * Thrown when an ID3v2 header declares a major version other than 2, 3 or 4.
 */
public class UnsupportedTagException extends BaseException {

    private static final long serialVersionUID = 1L;

    public UnsupportedTagException() {
        super();
    }

    public UnsupportedTagException(String message) {
        super(message);
    }

    public UnsupportedTagException(String message, Throwable cause) {
        super(message, cause);
    }
}
