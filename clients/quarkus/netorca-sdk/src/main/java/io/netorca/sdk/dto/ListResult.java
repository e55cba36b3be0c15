package io.netorca.sdk.dto;

import java.util.List;

/**
 * Generic list result with items and count.
 */
public record ListResult<T>(
    List<T> items,
    int count
) {
    public static <T> ListResult<T> of(List<T> items) {
        return new ListResult<>(List.copyOf(items), items.size());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
