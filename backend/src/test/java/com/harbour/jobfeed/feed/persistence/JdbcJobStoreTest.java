package com.harbour.jobfeed.feed.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.model.JobRecordRef;
import com.harbour.jobfeed.feed.model.ScrapedJob;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcJobStoreTest {

  @Autowired private JdbcJobStore store;

  private static ScrapedJob job(String link, String datePosted) {
    return new ScrapedJob(
        link,
        datePosted,
        "Acme",
        "Graduate Engineer Trainee",
        "Freshers",
        "Bangalore",
        "https://careers.acme.example/apply",
        "Build things");
  }

  private static String uniqueLink() {
    return "https://fresheropenings.com/acme-" + UUID.randomUUID();
  }

  @Test
  void insertedRecordIsFoundBySourceLink() {
    String link = uniqueLink();
    long id = store.insert(job(link, "2024-03-09"));

    List<JobRecord> found = store.findBySourceLink(link, 1);

    assertEquals(1, found.size());
    JobRecord record = found.get(0);
    assertEquals(id, record.id());
    assertEquals("Acme | Graduate Engineer Trainee", record.title());
    assertEquals("2024-03-09", record.datePosted());
    assertNotNull(record.createdAt());
  }

  @Test
  void sameSourceLinkCanBeStoredTwice() {
    String link = uniqueLink();
    long first = store.insert(job(link, "2024-03-01"));
    long second = store.insert(job(link, "2024-03-02"));

    assertTrue(second > first);
    assertEquals(2, store.findBySourceLink(link, 10).size());
    assertEquals(first, store.findBySourceLink(link, 1).get(0).id());
  }

  @Test
  void lookupTrimsAndIgnoresBlankLinks() {
    String link = uniqueLink();
    store.insert(job(link, "2024-03-01"));

    assertEquals(1, store.findBySourceLink("  " + link + " ", 1).size());
    assertTrue(store.findBySourceLink("   ", 1).isEmpty());
    assertTrue(store.findBySourceLink(null, 1).isEmpty());
  }

  @Test
  void deleteReportsWhetherARowWasRemoved() {
    long id = store.insert(job(uniqueLink(), "2024-03-01"));

    assertTrue(store.deleteById(id));
    assertFalse(store.deleteById(id));
  }

  @Test
  void recordRefsPageByIdAscending() {
    long a = store.insert(job(uniqueLink(), "2024-01-01"));
    long b = store.insert(job(uniqueLink(), "not-a-date"));
    long c = store.insert(job(null, null));

    List<JobRecordRef> firstPage = store.findRecordRefs(a - 1, 2);
    List<JobRecordRef> secondPage = store.findRecordRefs(firstPage.get(1).id(), 2);

    assertEquals(List.of(a, b), firstPage.stream().map(JobRecordRef::id).toList());
    assertEquals(c, secondPage.get(0).id());
    assertNull(secondPage.get(0).parsedDatePosted());
    assertEquals("", secondPage.get(0).normalizedSourceLink());
  }

  @Test
  void reachableAndCounts() {
    long before = store.countRecords();
    store.insert(job(uniqueLink(), "2024-03-01"));

    assertTrue(store.isReachable());
    assertEquals(before + 1, store.countRecords());
  }
}
