package com.phillippitts.catalogintel.service.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels (best first) and image quality flags returned by a {@link VisionLabelProvider}.
 */
public record VisionPrediction(List<VisionLabel> labels, boolean blurry, boolean lowRes, boolean dark,
                               String traceId) {

    public VisionPrediction {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean hasQualityIssue() {
        return blurry || lowRes || dark;
    }

    /**
     * Names of the raised quality flags, e.g. {@code [blurry, dark]}.
     */
    public List<String> qualityIssues() {
        List<String> issues = new ArrayList<>(3);
        if (blurry) {
            issues.add("blurry");
        }
        if (lowRes) {
            issues.add("low_res");
        }
        if (dark) {
            issues.add("dark");
        }
        return issues;
    }
}
