package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.config.FeedProperties;
import com.harbour.jobfeed.feed.model.PurgeSummary;
import com.harbour.jobfeed.feed.testing.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class JobPurgeServiceTest {
    private static final LocalDate TODAY = LocalDate.parse("2024-03-10");
    private static final Clock CLOCK = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private InMemoryJobStore store;
    private FeedProperties properties;
    private JobPurgeService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        properties = new FeedProperties();
        service = new JobPurgeService(store, new JobRecordDeleter(store), properties, CLOCK);
    }

    @Test
    void keepsOldestRecordOfDuplicateGroupWithUnknownDatesLast() {
        store.putWithId(1L, "https://fresheropenings.com/l", "2024-01-01");
        store.putWithId(2L, "https://fresheropenings.com/l", "2024-01-05");
        store.putWithId(3L, "https://fresheropenings.com/l", "not-a-date");

        PurgeSummary summary = service.purge();

        assertThat(store.ids()).containsExactly(1L);
        assertThat(summary.scheduledDuplicates()).isEqualTo(2);
        assertThat(summary.deleted()).isEqualTo(2);
        assertThat(summary.failed()).isZero();
    }

    @Test
    void unknownDatedRecordLosesEvenWhenItHasTheLowestId() {
        store.putWithId(1L, "https://fresheropenings.com/x", "");
        store.putWithId(2L, "https://fresheropenings.com/x", "2024-02-01");

        service.purge();

        assertThat(store.ids()).containsExactly(2L);
    }

    @Test
    void lowestIdWinsWhenDatesTie() {
        store.putWithId(7L, "https://fresheropenings.com/t", "2024-01-01");
        store.putWithId(4L, "https://fresheropenings.com/t", "2024-01-01");
        store.putWithId(9L, "https://fresheropenings.com/t", null);
        store.putWithId(8L, "https://fresheropenings.com/t", null);

        service.purge();

        assertThat(store.ids()).containsExactly(4L);
    }

    @Test
    void deletesRecentRecordEvenWhenItIsTheOnlyOneForItsLink() {
        long id = store.put("https://fresheropenings.com/m", TODAY.toString());

        PurgeSummary summary = service.purge();

        assertThat(store.ids()).doesNotContain(id);
        assertThat(summary.scheduledRecent()).isEqualTo(1);
        assertThat(summary.recentCutoff()).isEqualTo(LocalDate.parse("2024-03-08"));
    }

    @Test
    void recentCutoffIsInclusive() {
        long onCutoff = store.put("https://fresheropenings.com/a", "2024-03-08");
        long dayBefore = store.put("https://fresheropenings.com/b", "2024-03-07");

        service.purge();

        assertThat(store.ids()).doesNotContain(onCutoff).contains(dayBefore);
    }

    @Test
    void recentRecordsDoNotCompeteForSurvival() {
        long older = store.put("https://fresheropenings.com/r", "2024-02-01");
        long recent = store.put("https://fresheropenings.com/r", "2024-03-09");

        PurgeSummary summary = service.purge();

        assertThat(store.ids()).containsExactly(older);
        assertThat(summary.scheduledRecent()).isEqualTo(1);
        assertThat(summary.scheduledDuplicates()).isZero();
        assertThat(store.ids()).doesNotContain(recent);
    }

    @Test
    void recordsWithoutSourceLinkAreNeverCollapsed() {
        long blankA = store.put("", "2024-01-01");
        long blankB = store.put("", "2024-01-01");
        long nullLink = store.put(null, "2024-01-01");

        PurgeSummary summary = service.purge();

        assertThat(store.ids()).contains(blankA, blankB, nullLink);
        assertThat(summary.scheduled()).isZero();
    }

    @Test
    void sourceLinksAreComparedAfterTrimming() {
        long first = store.put("https://fresheropenings.com/s", "2024-01-01");
        store.put("  https://fresheropenings.com/s ", "2024-01-02");

        service.purge();

        assertThat(store.ids()).containsExactly(first);
    }

    @Test
    void secondCycleLeavesTheSameSurvivors() {
        store.put("https://fresheropenings.com/p", "2024-01-01");
        store.put("https://fresheropenings.com/p", "2024-01-02");
        store.put("https://freshersrecruitment.co.in/q", "garbage");
        store.put("https://freshersrecruitment.co.in/q", "2024-02-02");
        store.put("https://freshersrecruitment.co.in/z", "2024-03-10");
        store.put("", "2024-01-01");

        service.purge();
        Set<Long> afterFirst = store.ids();
        PurgeSummary second = service.purge();

        assertThat(store.ids()).isEqualTo(afterFirst);
        assertThat(second.scheduled()).isZero();
    }

    @Test
    void failedDeleteIsCountedAndOthersStillProceed() {
        store.putWithId(1L, "https://fresheropenings.com/f", "2024-01-01");
        store.putWithId(2L, "https://fresheropenings.com/f", "2024-01-02");
        store.putWithId(3L, "https://fresheropenings.com/f", "2024-01-03");
        store.putWithId(4L, "https://fresheropenings.com/g", TODAY.toString());
        store.failDeletesFor(2L);

        PurgeSummary summary = service.purge();

        assertThat(summary.scheduled()).isEqualTo(3);
        assertThat(summary.deleted()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(store.ids()).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void scanWalksEveryPage() {
        properties.getPurge().setScanBatchSize(2);
        for (int i = 0; i < 5; i++) {
            store.put("https://fresheropenings.com/page", "2024-01-0" + (i + 1));
        }

        PurgeSummary summary = service.purge();

        assertThat(summary.scanned()).isEqualTo(5);
        assertThat(store.ids()).hasSize(1);
    }
}
