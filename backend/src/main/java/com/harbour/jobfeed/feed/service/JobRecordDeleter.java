package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.feed.model.DeletionTally;
import com.harbour.jobfeed.feed.persistence.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Deletes records one at a time; a failed delete is logged and counted, and the rest proceed.
 */
@Component
public class JobRecordDeleter {
    private static final Logger log = LoggerFactory.getLogger(JobRecordDeleter.class);

    private final JobStore store;

    public JobRecordDeleter(JobStore store) {
        this.store = store;
    }

    public DeletionTally deleteEach(Collection<Long> ids, String reason) {
        int deleted = 0;
        int missing = 0;
        int failed = 0;
        for (Long id : ids) {
            try {
                if (store.deleteById(id)) {
                    deleted++;
                    log.debug("Deleted job record {} ({})", id, reason);
                } else {
                    missing++;
                    log.warn("Job record {} was already gone ({})", id, reason);
                }
            } catch (Exception e) {
                failed++;
                log.warn("Failed to delete job record {} ({})", id, reason, e);
            }
        }
        return new DeletionTally(deleted, missing, failed);
    }
}
