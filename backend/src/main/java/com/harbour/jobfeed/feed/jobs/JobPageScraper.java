package com.harbour.jobfeed.feed.jobs;

import com.harbour.jobfeed.feed.model.ScrapeResult;

public interface JobPageScraper {

    /**
     * Fetches and extracts one job page. Failures are reported through the result, never thrown.
     */
    ScrapeResult scrape(String url);
}
