package com.harbour.jobfeed.feed.channel;

import java.util.List;

/**
 * Supplies the de-duplicated candidate job URLs for one admission run.
 */
public interface CandidateUrlSource {

    List<String> fetchCandidateUrls();
}
