package com.phillippitts.catalogintel.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Audit trail explaining how one attribute value was chosen.
 *
 * @param attributeName     attribute key
 * @param sourcesConsidered sources that produced a candidate, in source declaration order
 * @param chosenSource      {@code text}, {@code vision}, {@code merged} or the winner's stub name
 * @param reason            human-readable explanation
 * @param conflicts         losing candidates, empty unless sources disagreed
 */
public record DecisionLogEntry(
        String attributeName,
        Set<AttributeSource> sourcesConsidered,
        String chosenSource,
        String reason,
        List<ConflictEntry> conflicts
) {

    public DecisionLogEntry {
        Objects.requireNonNull(attributeName, "attributeName must not be null");
        Objects.requireNonNull(chosenSource, "chosenSource must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        if (sourcesConsidered == null || sourcesConsidered.isEmpty()) {
            throw new IllegalArgumentException("sourcesConsidered must not be empty for " + attributeName);
        }
        sourcesConsidered = Collections.unmodifiableSet(EnumSet.copyOf(sourcesConsidered));
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }
}
