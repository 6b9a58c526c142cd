package com.phillippitts.catalogintel.service.fusion;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.ConflictEntry;
import com.phillippitts.catalogintel.domain.DecisionLogEntry;
import com.phillippitts.catalogintel.domain.ExtractorId;
import com.phillippitts.catalogintel.domain.FusedAttribute;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Fuses two candidates by agreement or by confidence.
 *
 * <p>Agreeing values (case-insensitive, trimmed) combine as a probabilistic OR of the two
 * confidences and keep the text value and both evidence lists, text first. Differing values go
 * to the strictly higher confidence; a tie goes to text. The losing candidate is recorded as a
 * conflict.
 */
public final class ConfidenceFusionEngine extends AbstractFusionEngine {

    public static final String CHOSEN_MERGED = "merged";
    public static final String REASON_AGREED = "Text and vision agreed on the attribute value.";
    public static final String REASON_DISAGREED = "Confidence comparison resolved a disagreement between modalities.";

    @Override
    protected AttributeDecision fuseBoth(String attributeName, AttributeCandidate text, AttributeCandidate vision) {
        EnumSet<AttributeSource> sources = EnumSet.of(AttributeSource.TEXT, AttributeSource.VISION);
        if (sameValue(text, vision)) {
            double combined = clamp(1.0 - (1.0 - text.confidence()) * (1.0 - vision.confidence()));
            List<String> evidence = new ArrayList<>(text.evidence());
            evidence.addAll(vision.evidence());
            FusedAttribute attribute = new FusedAttribute(text.value(), combined, ExtractorId.MERGED, evidence);
            DecisionLogEntry entry = new DecisionLogEntry(
                    attributeName, sources, CHOSEN_MERGED, REASON_AGREED, List.of());
            return new AttributeDecision(attribute, entry);
        }

        boolean visionWins = vision.confidence() > text.confidence();
        AttributeCandidate winner = visionWins ? vision : text;
        AttributeCandidate loser = visionWins ? text : vision;
        ExtractorId winnerId = winner.source().stubId();

        FusedAttribute attribute = new FusedAttribute(
                winner.value(), winner.confidence(), winnerId, winner.evidence());
        DecisionLogEntry entry = new DecisionLogEntry(
                attributeName, sources, winnerId.toString(), REASON_DISAGREED,
                List.of(ConflictEntry.from(loser)));
        return new AttributeDecision(attribute, entry);
    }
}
