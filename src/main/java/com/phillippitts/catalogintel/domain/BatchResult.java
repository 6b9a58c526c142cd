package com.phillippitts.catalogintel.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered outcome of a batch: successes and failures each sorted by request index.
 *
 * @param items   successful predictions sorted by index
 * @param errors  failures sorted by index
 * @param timings stage timings summed over successful records
 */
public record BatchResult(List<BatchItem> items, List<BatchError> errors, StageTimings timings) {

    public BatchResult {
        items = sorted(items, Comparator.comparingInt(BatchItem::index));
        errors = sorted(errors, Comparator.comparingInt(BatchError::index));
        timings = Objects.requireNonNullElse(timings, StageTimings.empty());
    }

    public static BatchResult of(List<BatchItem> items, List<BatchError> errors) {
        return new BatchResult(items, errors, StageTimings.empty());
    }

    /**
     * Number of request indices covered by this result.
     */
    public int size() {
        return items.size() + errors.size();
    }

    private static <T> List<T> sorted(List<T> source, Comparator<T> order) {
        if (source == null) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(source);
        copy.sort(order);
        return List.copyOf(copy);
    }
}
