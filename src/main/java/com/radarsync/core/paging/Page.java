package com.radarsync.core.paging;

import java.util.List;

/**
 * One page of a cursor-based remote listing.
 *
 * @param items      the items of this page, in remote order
 * @param nextCursor cursor of the following page, or null when this page is the last
 */
public record Page<T>(
        List<T> items,
        String nextCursor
) {
    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> Page<T> of(List<T> items, String nextCursor) {
        return new Page<>(items, nextCursor);
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public boolean hasNext() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
