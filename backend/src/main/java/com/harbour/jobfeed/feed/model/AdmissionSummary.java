package com.harbour.jobfeed.feed.model;

public record AdmissionSummary(
    int candidates,
    int skippedSeen,
    int skippedExisting,
    int scrapeFailed,
    int rejected,
    int inserted,
    int insertFailed,
    int notified
) {
}
