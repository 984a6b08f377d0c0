package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.persistence.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Point-in-time check for an existing record with a given source link.
 *
 * <p>Lookup failures answer {@code false}: a missed duplicate is collapsed later by
 * {@link JobPurgeService}, while an aborted admission run loses the whole batch.
 */
@Service
public class JobExistenceGate {
    private static final Logger log = LoggerFactory.getLogger(JobExistenceGate.class);

    private final JobStore store;

    public JobExistenceGate(JobStore store) {
        this.store = store;
    }

    public boolean exists(String sourceLink) {
        if (sourceLink == null || sourceLink.isBlank()) {
            return false;
        }
        try {
            List<JobRecord> matches = store.findBySourceLink(sourceLink, 1);
            return matches != null && !matches.isEmpty();
        } catch (Exception e) {
            log.warn("Existence lookup failed for {}; treating as absent", sourceLink, e);
            return false;
        }
    }
}
