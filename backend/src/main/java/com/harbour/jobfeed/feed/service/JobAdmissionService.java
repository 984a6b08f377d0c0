package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.feed.channel.CandidateUrlSource;
import com.harbour.jobfeed.feed.jobs.JobPageScraper;
import com.harbour.jobfeed.feed.model.AdmissionSummary;
import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.model.ScrapeResult;
import com.harbour.jobfeed.feed.model.ScrapedJob;
import com.harbour.jobfeed.feed.notify.JobNotifier;
import com.harbour.jobfeed.feed.persistence.JobStore;
import com.harbour.jobfeed.feed.seen.SeenUrlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns candidate URLs into stored job records.
 *
 * <p>URLs are handled one at a time. A URL is marked seen only after its insert succeeded or after
 * a terminal failure (existing record, scrape failure, rejected payload, failed write), so a crash
 * between insert and mark can at worst leave a duplicate for the purge cycle. Seen-set failures
 * abort the run.
 */
@Service
public class JobAdmissionService {
    private static final Logger log = LoggerFactory.getLogger(JobAdmissionService.class);

    private final SeenUrlStore seenUrls;
    private final JobExistenceGate existenceGate;
    private final JobPageScraper scraper;
    private final JobStore store;
    private final JobNotifier notifier;
    private final CandidateUrlSource candidateUrlSource;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public JobAdmissionService(
        SeenUrlStore seenUrls,
        JobExistenceGate existenceGate,
        JobPageScraper scraper,
        JobStore store,
        JobNotifier notifier,
        CandidateUrlSource candidateUrlSource,
        Clock clock
    ) {
        this.seenUrls = seenUrls;
        this.existenceGate = existenceGate;
        this.scraper = scraper;
        this.store = store;
        this.notifier = notifier;
        this.candidateUrlSource = candidateUrlSource;
        this.clock = clock;
    }

    public AdmissionSummary admitFromChannel() {
        return admit(candidateUrlSource.fetchCandidateUrls());
    }

    public AdmissionSummary admit(Collection<String> candidateUrls) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveAdmissionRunException("An admission run is already in progress");
        }
        try {
            return admitSequentially(distinct(candidateUrls));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private AdmissionSummary admitSequentially(List<String> urls) {
        int skippedSeen = 0;
        int skippedExisting = 0;
        int scrapeFailed = 0;
        int rejected = 0;
        int inserted = 0;
        int insertFailed = 0;
        int notified = 0;

        for (String url : urls) {
            if (seenUrls.contains(url)) {
                skippedSeen++;
                continue;
            }
            log.info("Processing candidate {}", url);

            if (existenceGate.exists(url)) {
                log.info("Job for {} already stored; skipping", url);
                seenUrls.add(url);
                skippedExisting++;
                continue;
            }

            ScrapeResult result = scrapeSafely(url);
            if (result == null || !result.isSuccessful()) {
                log.warn("Scrape failed for {} ({})", url, result == null ? "no_result" : result.failureReason());
                seenUrls.add(url);
                scrapeFailed++;
                continue;
            }

            ScrapedJob job = withSourceLink(result.job(), url);
            if (!job.hasCompany()) {
                log.warn("Rejecting {} because company is missing (company='{}')", url, job.company());
                seenUrls.add(url);
                rejected++;
                continue;
            }

            long id;
            try {
                id = store.insert(job);
            } catch (Exception e) {
                log.warn("Failed to store job for {}", url, e);
                seenUrls.add(url);
                insertFailed++;
                continue;
            }
            inserted++;
            log.info("Stored job record {} for {}", id, url);

            if (notifySafely(toRecord(id, job))) {
                notified++;
            }
            seenUrls.add(url);
        }

        AdmissionSummary summary = new AdmissionSummary(
            urls.size(),
            skippedSeen,
            skippedExisting,
            scrapeFailed,
            rejected,
            inserted,
            insertFailed,
            notified
        );
        log.info(
            "Admission finished: candidates={}, seen={}, existing={}, scrapeFailed={}, rejected={}, inserted={}, insertFailed={}, notified={}",
            summary.candidates(),
            summary.skippedSeen(),
            summary.skippedExisting(),
            summary.scrapeFailed(),
            summary.rejected(),
            summary.inserted(),
            summary.insertFailed(),
            summary.notified()
        );
        return summary;
    }

    private ScrapeResult scrapeSafely(String url) {
        try {
            return scraper.scrape(url);
        } catch (Exception e) {
            log.warn("Scraper threw for {}", url, e);
            return ScrapeResult.failed("scraper_exception");
        }
    }

    private boolean notifySafely(JobRecord record) {
        try {
            return notifier.notifyNewJob(record);
        } catch (Exception e) {
            log.warn("Notifier threw for job record {}", record.id(), e);
            return false;
        }
    }

    private ScrapedJob withSourceLink(ScrapedJob job, String url) {
        if (url.equals(job.sourceLink())) {
            return job;
        }
        return new ScrapedJob(
            url,
            job.datePosted(),
            job.company(),
            job.jobTitle(),
            job.experience(),
            job.location(),
            job.applyLink(),
            job.description()
        );
    }

    private JobRecord toRecord(long id, ScrapedJob job) {
        return new JobRecord(
            id,
            job.sourceLink(),
            job.datePosted(),
            job.company(),
            job.jobTitle(),
            job.displayTitle(),
            job.experience(),
            job.location(),
            job.applyLink(),
            job.description(),
            Instant.now(clock)
        );
    }

    private List<String> distinct(Collection<String> candidateUrls) {
        if (candidateUrls == null) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        for (String candidate : candidateUrls) {
            if (candidate != null && !candidate.isBlank()) {
                urls.add(candidate.trim());
            }
        }
        return List.copyOf(urls);
    }
}
