package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.model.DeletionTally;
import com.harbour.jobfeed.feed.model.JobRecordRef;
import com.harbour.jobfeed.feed.model.PurgeSummary;
import com.harbour.jobfeed.feed.persistence.JobStore;
import com.harbour.jobfeed.feed.util.JobDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full-store sweep that removes not-yet-stable recent records and collapses every group of
 * records sharing a source link down to its oldest member.
 */
@Service
public class JobPurgeService {
    private static final Logger log = LoggerFactory.getLogger(JobPurgeService.class);

    /** Oldest known date first, unknown dates last, lowest id on ties. */
    static final Comparator<JobRecordRef> SURVIVOR_ORDER = Comparator
        .comparing(JobRecordRef::parsedDatePosted, JobDates.KNOWN_FIRST)
        .thenComparingLong(JobRecordRef::id);

    private final JobStore store;
    private final JobRecordDeleter deleter;
    private final FeedProperties properties;
    private final Clock clock;

    public JobPurgeService(JobStore store, JobRecordDeleter deleter, FeedProperties properties, Clock clock) {
        this.store = store;
        this.deleter = deleter;
        this.properties = properties;
        this.clock = clock;
    }

    public PurgeSummary purge() {
        LocalDate recentCutoff = LocalDate.now(clock).minusDays(properties.getPurge().getRecentGraceDays());
        int batchSize = properties.getPurge().getScanBatchSize();
        log.info("Purge cycle started; recent cutoff={}", recentCutoff);

        Set<Long> recentIds = new LinkedHashSet<>();
        Map<String, List<JobRecordRef>> byLink = new HashMap<>();
        int scanned = 0;
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
                if (posted != null && !posted.isBefore(recentCutoff)) {
                    recentIds.add(ref.id());
                    continue;
                }
                String link = ref.normalizedSourceLink();
                if (link.isEmpty()) {
                    continue;
                }
                byLink.computeIfAbsent(link, ignored -> new ArrayList<>(1)).add(ref);
            }
        }

        Set<Long> duplicateIds = new LinkedHashSet<>();
        for (Map.Entry<String, List<JobRecordRef>> group : byLink.entrySet()) {
            List<JobRecordRef> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            members.sort(SURVIVOR_ORDER);
            JobRecordRef survivor = members.get(0);
            for (JobRecordRef member : members.subList(1, members.size())) {
                duplicateIds.add(member.id());
            }
            log.info(
                "Source link {} has {} records; keeping {}, deleting {}",
                group.getKey(),
                members.size(),
                survivor.id(),
                members.size() - 1
            );
        }

        Set<Long> scheduled = new LinkedHashSet<>(recentIds);
        scheduled.addAll(duplicateIds);
        log.info(
            "Purge scanned {} records; scheduled recent={}, duplicates={}, total={}",
            scanned,
            recentIds.size(),
            duplicateIds.size(),
            scheduled.size()
        );

        DeletionTally tally = deleter.deleteEach(scheduled, "purge");
        PurgeSummary summary = new PurgeSummary(
            recentCutoff,
            scanned,
            recentIds.size(),
            duplicateIds.size(),
            scheduled.size(),
            tally.deleted(),
            tally.missing(),
            tally.failed()
        );
        log.info(
            "Purge cycle completed: deleted={}, missing={}, failed={}",
            summary.deleted(),
            summary.missing(),
            summary.failed()
        );
        return summary;
    }
}
