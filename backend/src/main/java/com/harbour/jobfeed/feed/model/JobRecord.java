package com.harbour.jobfeed.feed.model;

import java.time.Instant;

public record JobRecord(
    long id,
    String sourceLink,
    String datePosted,
    String company,
    String jobTitle,
    String title,
    String experience,
    String location,
    String applyLink,
    String description,
    Instant createdAt
) {
}
