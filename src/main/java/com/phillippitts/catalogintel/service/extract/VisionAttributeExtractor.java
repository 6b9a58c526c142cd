package com.phillippitts.catalogintel.service.extract;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.exception.ExtractionException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.util.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the top vision label to {@code category} and {@code room_type} candidates.
 *
 * <p>When the image has quality issues, confidences drop by the configured penalty
 * (floored at zero) and the evidence records the adjustment.
 */
public class VisionAttributeExtractor implements AttributeExtractor {

    private static final Logger LOG = LogManager.getLogger(VisionAttributeExtractor.class);

    private static final Map<String, String> CATEGORY_BY_LABEL = Map.of(
            "sofa", "Sofa",
            "sectional", "Sectional",
            "bed", "Bed",
            "table", "Table",
            "chair", "Chair",
            "lamp", "Lighting",
            "dresser", "Dresser",
            "rug", "Rug",
            "desk", "Desk",
            "bench", "Bench");

    private static final Map<String, String> ROOM_BY_LABEL = Map.of(
            "sofa", "Living Room",
            "sectional", "Living Room",
            "bed", "Bedroom",
            "table", "Dining Room",
            "lamp", "Living Room",
            "rug", "Living Room",
            "desk", "Home Office",
            "bench", "Entryway");

    private final VisionLabelProvider provider;
    private final double qualityPenalty;

    public VisionAttributeExtractor(VisionLabelProvider provider, double qualityPenalty) {
        if (qualityPenalty < 0.0 || qualityPenalty > 1.0) {
            throw new IllegalArgumentException("qualityPenalty must be within [0,1], got: " + qualityPenalty);
        }
        this.provider = provider;
        this.qualityPenalty = qualityPenalty;
    }

    @Override
    public AttributeSource source() {
        return AttributeSource.VISION;
    }

    @Override
    public List<AttributeCandidate> extract(IngestedRecord record, Deadline deadline) {
        if (!record.hasImage()) {
            return List.of();
        }
        if (!Files.isReadable(record.imagePath())) {
            throw new ExtractionException(StageErrorType.UNREACHABLE_RESOURCE,
                    "Image not readable: " + record.imagePath());
        }

        VisionPrediction prediction = provider.predict(record.imagePath());
        if (prediction.labels().isEmpty()) {
            return List.of();
        }
        VisionLabel top = prediction.labels().get(0);
        String label = top.name().toLowerCase(Locale.ROOT);

        double confidence = top.confidence();
        String adjustment = null;
        if (prediction.hasQualityIssue() && qualityPenalty > 0.0) {
            confidence = Math.max(0.0, confidence - qualityPenalty);
            adjustment = "vision confidence adjusted for " + String.join(", ", prediction.qualityIssues())
                    + " (-" + qualityPenalty + ")";
            LOG.debug("Vision trace {} penalized: {}", prediction.traceId(), adjustment);
        }

        List<AttributeCandidate> candidates = new ArrayList<>(2);
        addCandidate(candidates, AttributeNames.CATEGORY, CATEGORY_BY_LABEL.get(label), top, confidence, adjustment);
        addCandidate(candidates, AttributeNames.ROOM_TYPE, ROOM_BY_LABEL.get(label), top, confidence, adjustment);
        return candidates;
    }

    private static void addCandidate(List<AttributeCandidate> out, String attribute, String value,
                                     VisionLabel label, double confidence, String adjustment) {
        if (value == null) {
            return;
        }
        List<String> evidence = new ArrayList<>(2);
        evidence.add("vision label: " + value + " (" + label.name() + ")");
        if (adjustment != null) {
            evidence.add(adjustment);
        }
        out.add(AttributeCandidate.vision(attribute, value, confidence, evidence));
    }
}
