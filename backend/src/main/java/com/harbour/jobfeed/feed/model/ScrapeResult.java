package com.harbour.jobfeed.feed.model;

public record ScrapeResult(ScrapedJob job, String failureReason) {

    public static ScrapeResult success(ScrapedJob job) {
        return new ScrapeResult(job, null);
    }

    public static ScrapeResult failed(String reason) {
        return new ScrapeResult(null, reason);
    }

    public boolean isSuccessful() {
        return job != null && failureReason == null;
    }
}
