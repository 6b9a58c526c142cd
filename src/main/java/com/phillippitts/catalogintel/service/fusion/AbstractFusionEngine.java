package com.phillippitts.catalogintel.service.fusion;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.DecisionLogEntry;
import com.phillippitts.catalogintel.domain.FusedAttribute;
import com.phillippitts.catalogintel.domain.PredictionRecord;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Base class for fusion engines implementing grouping and single-source handling.
 *
 * <p>This class implements the Template Method pattern: {@link #fuse} groups candidates by
 * attribute name and source, then decides each attribute:
 * <ul>
 *   <li>No candidate → attribute omitted</li>
 *   <li>One source → its candidate passes through unchanged</li>
 *   <li>Text and vision → delegated to {@link #fuseBoth}</li>
 * </ul>
 *
 * <p>When one source yields several candidates for the same attribute, the highest
 * confidence wins and the first one seen wins a tie.
 */
public abstract class AbstractFusionEngine implements FusionEngine {

    public static final String REASON_SINGLE_SOURCE = "only modality produced a value";

    @Override
    public final PredictionRecord fuse(String productId, String title, Collection<AttributeCandidate> candidates) {
        Map<String, EnumMap<AttributeSource, AttributeCandidate>> grouped = group(candidates);

        Map<String, FusedAttribute> predictions = new TreeMap<>();
        Map<String, DecisionLogEntry> decisionLog = new TreeMap<>();
        for (Map.Entry<String, EnumMap<AttributeSource, AttributeCandidate>> entry : grouped.entrySet()) {
            AttributeDecision decision = decide(entry.getKey(), entry.getValue());
            predictions.put(entry.getKey(), decision.attribute());
            decisionLog.put(entry.getKey(), decision.logEntry());
        }
        return PredictionRecord.of(productId, title, predictions, decisionLog);
    }

    /**
     * Decides an attribute for which both text and vision produced a candidate.
     *
     * @param attributeName attribute key
     * @param text          text candidate (never null)
     * @param vision        vision candidate (never null)
     * @return fused value with its decision log entry
     */
    protected abstract AttributeDecision fuseBoth(String attributeName,
                                                  AttributeCandidate text,
                                                  AttributeCandidate vision);

    private AttributeDecision decide(String attributeName, EnumMap<AttributeSource, AttributeCandidate> bySource) {
        AttributeCandidate text = bySource.get(AttributeSource.TEXT);
        AttributeCandidate vision = bySource.get(AttributeSource.VISION);
        if (text != null && vision != null) {
            return fuseBoth(attributeName, text, vision);
        }
        return passThrough(attributeName, text != null ? text : vision);
    }

    /**
     * Lone candidate: value, confidence and evidence are kept; no conflicts.
     */
    protected final AttributeDecision passThrough(String attributeName, AttributeCandidate only) {
        FusedAttribute attribute = new FusedAttribute(
                only.value(), only.confidence(), only.source().stubId(), only.evidence());
        DecisionLogEntry entry = new DecisionLogEntry(
                attributeName,
                EnumSet.of(only.source()),
                only.source().toString(),
                REASON_SINGLE_SOURCE,
                List.of());
        return new AttributeDecision(attribute, entry);
    }

    /**
     * Case-insensitive, trimmed value comparison.
     */
    protected static boolean sameValue(AttributeCandidate a, AttributeCandidate b) {
        return a.value().trim().equalsIgnoreCase(b.value().trim());
    }

    protected static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static Map<String, EnumMap<AttributeSource, AttributeCandidate>> group(
            Collection<AttributeCandidate> candidates) {
        Map<String, EnumMap<AttributeSource, AttributeCandidate>> grouped = new TreeMap<>();
        if (candidates == null) {
            return grouped;
        }
        for (AttributeCandidate candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            grouped.computeIfAbsent(candidate.attributeName(), k -> new EnumMap<>(AttributeSource.class))
                    .merge(candidate.source(), candidate,
                            (kept, next) -> next.confidence() > kept.confidence() ? next : kept);
        }
        return grouped;
    }
}
