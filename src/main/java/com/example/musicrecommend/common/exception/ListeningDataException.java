package com.example.musicrecommend.common.exception;

/**
 * A read from the listening data store failed, timed out or was interrupted.
 */
public class ListeningDataException extends RuntimeException {

    public enum Source {
        CATALOG,
        HISTORY,
        LIKED,
        LISTENER
    }

    private final Source source;

    public ListeningDataException(Source source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Source getSource() {
        return source;
    }
}
