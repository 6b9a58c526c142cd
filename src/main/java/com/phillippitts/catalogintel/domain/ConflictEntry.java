package com.phillippitts.catalogintel.domain;

import java.util.Objects;

/**
 * A candidate that lost a disagreement, kept in the decision log.
 */
public record ConflictEntry(AttributeSource source, String value, double confidence) {

    public ConflictEntry {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ConflictEntry from(AttributeCandidate candidate) {
        return new ConflictEntry(candidate.source(), candidate.value(), candidate.confidence());
    }
}
