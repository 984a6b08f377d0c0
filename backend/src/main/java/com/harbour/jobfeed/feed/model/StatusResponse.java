package com.harbour.jobfeed.feed.model;

import java.time.Instant;

public record StatusResponse(
    boolean dbConnected,
    long jobRecordCount,
    int seenUrlCount,
    Instant serverTime
) {
}
