package com.phillippitts.catalogintel.domain;

import java.util.Objects;

/**
 * Successful prediction tagged with its original request position.
 */
public record BatchItem(int index, PredictionRecord prediction) {

    public BatchItem {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(prediction, "prediction must not be null");
    }
}
