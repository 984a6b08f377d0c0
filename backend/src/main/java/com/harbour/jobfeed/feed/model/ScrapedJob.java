package com.harbour.jobfeed.feed.model;

import java.util.Locale;

public record ScrapedJob(
    String sourceLink,
    String datePosted,
    String company,
    String jobTitle,
    String experience,
    String location,
    String applyLink,
    String description
) {
    public static final String NOT_AVAILABLE = "N/A";

    public String displayTitle() {
        return orNotAvailable(company) + " | " + orNotAvailable(jobTitle);
    }

    public boolean hasCompany() {
        if (company == null || company.isBlank()) {
            return false;
        }
        return !NOT_AVAILABLE.equals(company.trim().toUpperCase(Locale.ROOT));
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value.trim();
    }
}
