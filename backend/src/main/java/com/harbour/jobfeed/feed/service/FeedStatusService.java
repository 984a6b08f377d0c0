package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.feed.model.StatusResponse;
import com.harbour.jobfeed.feed.persistence.JobStore;
import com.harbour.jobfeed.feed.seen.SeenUrlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class FeedStatusService {
    private static final Logger log = LoggerFactory.getLogger(FeedStatusService.class);

    private final JobStore store;
    private final SeenUrlStore seenUrls;
    private final Clock clock;

    public FeedStatusService(JobStore store, SeenUrlStore seenUrls, Clock clock) {
        this.store = store;
        this.seenUrls = seenUrls;
        this.clock = clock;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        long records = 0L;
        try {
            dbConnected = store.isReachable();
            if (dbConnected) {
                records = store.countRecords();
            }
        } catch (Exception e) {
            log.warn("Job store unreachable", e);
            dbConnected = false;
        }
        return new StatusResponse(dbConnected, records, seenUrls.size(), Instant.now(clock));
    }
}
