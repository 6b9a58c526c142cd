package com.phillippitts.catalogintel.service.fusion;

import com.phillippitts.catalogintel.domain.DecisionLogEntry;
import com.phillippitts.catalogintel.domain.FusedAttribute;

import java.util.Objects;

/**
 * Fused value and its decision log entry for one attribute.
 */
public record AttributeDecision(FusedAttribute attribute, DecisionLogEntry logEntry) {

    public AttributeDecision {
        Objects.requireNonNull(attribute, "attribute must not be null");
        Objects.requireNonNull(logEntry, "logEntry must not be null");
    }
}
