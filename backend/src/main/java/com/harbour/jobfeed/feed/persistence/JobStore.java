package com.harbour.jobfeed.feed.persistence;

import com.harbour.jobfeed.feed.model.JobRecord;
import com.harbour.jobfeed.feed.model.JobRecordRef;
import com.harbour.jobfeed.feed.model.ScrapedJob;

import java.util.List;

/**
 * Shared job record store. Every operation touches a single record or reads a page of records;
 * nothing here spans a multi-record transaction.
 */
public interface JobStore {

    List<JobRecord> findBySourceLink(String sourceLink, int limit);

    long insert(ScrapedJob job);

    /**
     * @return {@code true} when a record was removed, {@code false} when it was already gone
     */
    boolean deleteById(long id);

    /**
     * Keyset page of record metadata ordered by id, starting strictly after {@code afterId}.
     */
    List<JobRecordRef> findRecordRefs(long afterId, int limit);

    long countRecords();

    boolean isReachable();
}
