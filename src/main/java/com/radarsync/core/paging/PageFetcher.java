package com.radarsync.core.paging;

/**
 * Fetches one page of a remote listing. A null cursor requests the first page.
 */
@FunctionalInterface
public interface PageFetcher<T> {

    Page<T> fetch(String cursor);
}
