package com.mpatric.id3tag;

/**
 * Base class for all checked exceptions thrown while reading or writing tags.
 */
public class BaseException extends Exception {

    private static final long serialVersionUID = 1L;

    public BaseException() {
        super();
    }

    public BaseException(String message) {
        super(message);
    }

    public BaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the messages of this exception and all of its causes, each prefixed by
     * the class name, e.g. {@code [a.B: x] caused by [c.D: y]}.
     *
     * @return the detailed message
     */
    public String getDetailedMessage() {
        Throwable t = this;
        StringBuilder s = new StringBuilder();
        while (true) {
            s.append('[');
            s.append(t.getClass().getName());
            if (t.getMessage() != null && t.getMessage().length() > 0) {
                s.append(": ");
                s.append(t.getMessage());
            }
            s.append(']');
            t = t.getCause();
            if (t != null) {
                s.append(" caused by ");
            } else {
                break;
            }
        }
        return s.toString();
    }
}
