package com.harbour.jobfeed.feed.seen;

/**
 * Environment-local, append-only record of source URLs that admission has already handled.
 *
 * <p>Implementations must make each {@link #add(String)} durable before returning and must raise
 * {@link SeenUrlStoreException} when the backing medium cannot be read or written.
 */
public interface SeenUrlStore {

    boolean contains(String url);

    void add(String url);

    int size();
}
