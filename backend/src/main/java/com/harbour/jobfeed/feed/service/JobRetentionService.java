package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.model.DeletionTally;
import com.harbour.jobfeed.feed.model.JobRecordRef;
import com.harbour.jobfeed.feed.model.RetentionSummary;
import com.harbour.jobfeed.feed.persistence.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deletes records whose posting date is older than the retention horizon. Records without a
 * usable date are left alone.
 */
@Service
public class JobRetentionService {
    private static final Logger log = LoggerFactory.getLogger(JobRetentionService.class);

    private final JobStore store;
    private final JobRecordDeleter deleter;
    private final FeedProperties properties;
    private final Clock clock;

    public JobRetentionService(JobStore store, JobRecordDeleter deleter, FeedProperties properties, Clock clock) {
        this.store = store;
        this.deleter = deleter;
        this.properties = properties;
        this.clock = clock;
    }

    public RetentionSummary purgeExpired() {
        return purgeOlderThan(properties.getRetention().getMaxAge());
    }

    public RetentionSummary purgeOlderThan(Duration maxAge) {
        Duration horizon = maxAge == null ? properties.getRetention().getMaxAge() : maxAge;
        LocalDate cutoff = LocalDate.now(clock).minusDays(Math.max(1L, horizon.toDays()));
        int batchSize = properties.getPurge().getScanBatchSize();
        log.info("Retention sweep started; deleting records posted before {}", cutoff);

        Set<Long> expired = new LinkedHashSet<>();
        int scanned = 0;
        int undated = 0;
        long lastId = 0L;
        while (true) {
            List<JobRecordRef> page = store.findRecordRefs(lastId, batchSize);
            if (page.isEmpty()) {
                break;
            }
            for (JobRecordRef ref : page) {
                lastId = Math.max(lastId, ref.id());
                scanned++;
                LocalDate posted = ref.parsedDatePosted();
                if (posted == null) {
                    undated++;
                    log.debug("Skipping job record {} with unusable date '{}'", ref.id(), ref.datePosted());
                    continue;
                }
                if (posted.isBefore(cutoff)) {
                    expired.add(ref.id());
                }
            }
        }

        DeletionTally tally = deleter.deleteEach(expired, "retention");
        RetentionSummary summary = new RetentionSummary(
            cutoff,
            scanned,
            undated,
            expired.size(),
            tally.deleted(),
            tally.missing(),
            tally.failed()
        );
        log.info(
            "Retention sweep completed: scanned={}, undated={}, expired={}, deleted={}, failed={}",
            summary.scanned(),
            summary.undated(),
            summary.scheduled(),
            summary.deleted(),
            summary.failed()
        );
        return summary;
    }
}
