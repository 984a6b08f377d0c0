package com.harbour.jobfeed.feed.model;

import java.time.LocalDate;

public record RetentionSummary(
    LocalDate cutoff,
    int scanned,
    int undated,
    int scheduled,
    int deleted,
    int missing,
    int failed
) {
}
