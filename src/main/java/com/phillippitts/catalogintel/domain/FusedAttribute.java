package com.phillippitts.catalogintel.domain;

import java.util.List;
import java.util.Objects;

/**
 * Final value chosen for one attribute of one record.
 */
public record FusedAttribute(
        String value,
        double confidence,
        ExtractorId extractedBy,
        List<String> evidence
) {

    public FusedAttribute {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(extractedBy, "extractedBy must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
