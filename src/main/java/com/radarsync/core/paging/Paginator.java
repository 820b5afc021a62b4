package com.radarsync.core.paging;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-use walk over a cursor-based remote listing.
 * <p>
 * Buffers at most one page. Ends on an empty page or a missing next cursor. A failing
 * fetch propagates to the caller and ends the walk; there are no retries. Each page
 * advances the remote cursor, so {@link #iterator()} may only be obtained once.
 */
public final class Paginator<T> implements Iterable<T> {

    private final PageFetcher<T> fetcher;
    private boolean consumed;

    private Paginator(PageFetcher<T> fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
    }

    public static <T> Paginator<T> over(PageFetcher<T> fetcher) {
        return new Paginator<>(fetcher);
    }

    /**
     * Starts the walk after a page that was already fetched by other means.
     */
    public static <T> Paginator<T> continuing(Page<T> firstPage, PageFetcher<T> fetcher) {
        Objects.requireNonNull(firstPage, "firstPage must not be null");
        return new Paginator<>(new PageFetcher<>() {
            private boolean servedFirst;

            @Override
            public Page<T> fetch(String cursor) {
                if (!servedFirst) {
                    servedFirst = true;
                    return firstPage;
                }
                return fetcher.fetch(cursor);
            }
        });
    }

    @Override
    public synchronized Iterator<T> iterator() {
        if (consumed) {
            throw new IllegalStateException("Paginator is not restartable");
        }
        consumed = true;
        return new PageIterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    public List<T> toList() {
        List<T> items = new ArrayList<>();
        iterator().forEachRemaining(items::add);
        return items;
    }

    private final class PageIterator implements Iterator<T> {

        private Iterator<T> current = null;
        private String cursor = null;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            while (!exhausted && (current == null || !current.hasNext())) {
                if (current != null && cursor == null) {
                    exhausted = true;
                    break;
                }
                advance();
            }
            return !exhausted;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private void advance() {
            Page<T> page;
            try {
                page = fetcher.fetch(cursor);
            } catch (RuntimeException e) {
                exhausted = true;
                throw e;
            }
            if (page == null || page.items().isEmpty()) {
                exhausted = true;
                return;
            }
            current = page.items().iterator();
            cursor = page.hasNext() ? page.nextCursor() : null;
        }
    }
}
