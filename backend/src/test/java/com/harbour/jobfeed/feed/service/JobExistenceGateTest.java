package com.harbour.jobfeed.feed.service;

import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.persistence.JobStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobExistenceGateTest {
    private static final String URL = "https://fresheropenings.com/acme-hiring";

    @Mock
    private JobStore store;

    @Test
    void reportsExistingRecord() {
        JobRecord record = new JobRecord(1L, URL, "2024-01-01", "Acme", "Engineer", "Acme | Engineer",
            "N/A", "N/A", "N/A", "N/A", Instant.EPOCH);
        when(store.findBySourceLink(URL, 1)).thenReturn(List.of(record));

        assertTrue(new JobExistenceGate(store).exists(URL));
    }

    @Test
    void reportsAbsentRecord() {
        when(store.findBySourceLink(URL, 1)).thenReturn(List.of());

        assertFalse(new JobExistenceGate(store).exists(URL));
    }

    @Test
    void lookupFailureFailsOpen() {
        when(store.findBySourceLink(URL, 1)).thenThrow(new DataAccessResourceFailureException("store down"));

        assertFalse(new JobExistenceGate(store).exists(URL));
    }

    @Test
    void blankLinkNeverHitsTheStore() {
        JobExistenceGate gate = new JobExistenceGate(store);

        assertFalse(gate.exists("  "));
        assertFalse(gate.exists(null));
        verifyNoInteractions(store);
    }
}
