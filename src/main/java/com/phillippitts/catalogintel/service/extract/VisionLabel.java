package com.phillippitts.catalogintel.service.extract;

import java.util.Objects;

/**
 * A label detected in an image with its model confidence.
 */
public record VisionLabel(String name, double confidence) {

    public VisionLabel {
        Objects.requireNonNull(name, "name must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
