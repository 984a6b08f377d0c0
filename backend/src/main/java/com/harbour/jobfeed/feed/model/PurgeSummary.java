package com.harbour.jobfeed.feed.model;

import java.time.LocalDate;

public record PurgeSummary(
    LocalDate recentCutoff,
    int scanned,
    int scheduledRecent,
    int scheduledDuplicates,
    int scheduled,
    int deleted,
    int missing,
    int failed
) {
}
