package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.model.RetentionSummary;
import com.harbour.jobfeed.feed.testing.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class JobRetentionServiceTest {
    private static final LocalDate TODAY = LocalDate.parse("2024-06-30");
    private static final Clock CLOCK = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private InMemoryJobStore store;
    private FeedProperties properties;
    private JobRetentionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        properties = new FeedProperties();
        service = new JobRetentionService(store, new JobRecordDeleter(store), properties, CLOCK);
    }

    @Test
    void deletesRecordsPostedBeforeTheDefaultHorizon() {
        long expired = store.put("https://fresheropenings.com/old", "2024-03-01");
        long onCutoff = store.put("https://fresheropenings.com/edge", "2024-04-01");
        long fresh = store.put("https://fresheropenings.com/new", "2024-06-01");

        RetentionSummary summary = service.purgeExpired();

        assertThat(summary.cutoff()).isEqualTo(LocalDate.parse("2024-04-01"));
        assertThat(store.ids()).doesNotContain(expired).contains(onCutoff, fresh);
        assertThat(summary.deleted()).isEqualTo(1);
    }

    @Test
    void keepsRecordsWithoutUsableDate() {
        long blank = store.put("https://fresheropenings.com/a", "");
        long garbage = store.put("https://fresheropenings.com/b", "June 1st");

        RetentionSummary summary = service.purgeExpired();

        assertThat(store.ids()).contains(blank, garbage);
        assertThat(summary.undated()).isEqualTo(2);
        assertThat(summary.scheduled()).isZero();
    }

    @Test
    void honoursExplicitHorizonIgnoringDuplicates() {
        long a = store.put("https://fresheropenings.com/dup", "2024-06-10");
        long b = store.put("https://fresheropenings.com/dup", "2024-06-25");

        RetentionSummary summary = service.purgeOlderThan(Duration.ofDays(10));

        assertThat(summary.cutoff()).isEqualTo(LocalDate.parse("2024-06-20"));
        assertThat(store.ids()).containsExactly(b);
        assertThat(store.ids()).doesNotContain(a);
    }

    @Test
    void configuredHorizonIsUsed() {
        properties.getRetention().setMaxAge(Duration.ofDays(30));
        long expired = store.put("https://fresheropenings.com/c", "2024-05-20");

        service.purgeExpired();

        assertThat(store.ids()).doesNotContain(expired);
    }

    @Test
    void oneFailedDeleteDoesNotStopTheSweep() {
        long first = store.put("https://fresheropenings.com/1", "2023-01-01");
        long second = store.put("https://fresheropenings.com/2", "2023-01-02");
        store.failDeletesFor(first);

        RetentionSummary summary = service.purgeExpired();

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.deleted()).isEqualTo(1);
        assertThat(store.ids()).containsExactly(first);
        assertThat(store.ids()).doesNotContain(second);
    }
}
