package com.harbour.jobfeed.feed.model;

import com.harbour.jobfeed.feed.util.JobDates;

import java.time.LocalDate;

/**
 * The slice of a stored job record that purge decisions need.
 */
public record JobRecordRef(long id, String sourceLink, String datePosted) {

    public LocalDate parsedDatePosted() {
        return JobDates.parse(datePosted);
    }

    public String normalizedSourceLink() {
        return sourceLink == null ? "" : sourceLink.trim();
    }
}
