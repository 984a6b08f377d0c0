package com.harbour.jobfeed.feed.model;

public record DeletionTally(int deleted, int missing, int failed) {
}
