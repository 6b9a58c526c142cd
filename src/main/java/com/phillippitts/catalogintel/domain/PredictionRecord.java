package com.phillippitts.catalogintel.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Fused predictions for one product, with a decision log entry per predicted attribute.
 *
 * <p>Both maps are sorted by attribute name and always share the same key set.
 */
public record PredictionRecord(
        String productId,
        String title,
        SortedMap<String, FusedAttribute> finalPredictions,
        SortedMap<String, DecisionLogEntry> decisionLog
) {

    /**
     * @throws IllegalArgumentException if the prediction and decision log keys differ
     */
    public PredictionRecord {
        Objects.requireNonNull(productId, "productId must not be null");
        title = title == null ? "" : title;
        finalPredictions = freeze(finalPredictions);
        decisionLog = freeze(decisionLog);
        if (!finalPredictions.keySet().equals(decisionLog.keySet())) {
            throw new IllegalArgumentException("Predictions " + finalPredictions.keySet()
                    + " and decision log " + decisionLog.keySet() + " must share keys");
        }
    }

    public static PredictionRecord of(String productId, String title,
                                      Map<String, FusedAttribute> finalPredictions,
                                      Map<String, DecisionLogEntry> decisionLog) {
        return new PredictionRecord(productId, title,
                finalPredictions == null ? null : new TreeMap<>(finalPredictions),
                decisionLog == null ? null : new TreeMap<>(decisionLog));
    }

    private static <V> SortedMap<String, V> freeze(Map<String, V> source) {
        if (source == null) {
            return Collections.emptySortedMap();
        }
        return Collections.unmodifiableSortedMap(new TreeMap<>(source));
    }
}
