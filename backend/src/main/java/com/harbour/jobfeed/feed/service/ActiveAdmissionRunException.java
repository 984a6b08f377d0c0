package com.harbour.jobfeed.feed.service;

public class ActiveAdmissionRunException extends RuntimeException {
    public ActiveAdmissionRunException(String message) {
        super(message);
    }
}
