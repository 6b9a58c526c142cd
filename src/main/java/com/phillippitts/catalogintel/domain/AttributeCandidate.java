package com.phillippitts.catalogintel.domain;

import java.util.List;
import java.util.Objects;

/**
 * An attribute value proposed by one extraction source.
 *
 * @param attributeName attribute key such as {@code category} or {@code material}
 * @param value         proposed value (never blank)
 * @param confidence    score between 0.0 and 1.0
 * @param source        source that produced the value
 * @param evidence      ordered supporting snippets
 */
public record AttributeCandidate(
        String attributeName,
        String value,
        double confidence,
        AttributeSource source,
        List<String> evidence
) {

    /**
     * @throws IllegalArgumentException if the name or value is blank or confidence is out of range
     */
    public AttributeCandidate {
        Objects.requireNonNull(attributeName, "attributeName must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (attributeName.isBlank()) {
            throw new IllegalArgumentException("attributeName must not be blank");
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank for attribute " + attributeName);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static AttributeCandidate text(String attributeName, String value, double confidence,
                                          List<String> evidence) {
        return new AttributeCandidate(attributeName, value, confidence, AttributeSource.TEXT, evidence);
    }

    public static AttributeCandidate vision(String attributeName, String value, double confidence,
                                            List<String> evidence) {
        return new AttributeCandidate(attributeName, value, confidence, AttributeSource.VISION, evidence);
    }
}
