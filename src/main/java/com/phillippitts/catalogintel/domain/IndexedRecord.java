package com.phillippitts.catalogintel.domain;

import java.util.Objects;

/**
 * A product record paired with its position in the request.
 */
public record IndexedRecord(int index, ProductRecord record) {

    public IndexedRecord {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(record, "record must not be null");
    }
}
