package com.harbour.jobfeed.feed.seen;

public class SeenUrlStoreException extends RuntimeException {
    public SeenUrlStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
