package com.mpatric.id3tag;

public class BadCompressedDataException extends InvalidDataException {

    private static final long serialVersionUID = 1L;

    public BadCompressedDataException(String message) {
        super(message);
    }

    public BadCompressedDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
