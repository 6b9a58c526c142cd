package com.phillippitts.catalogintel.service.fusion;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.PredictionRecord;

import java.util.Collection;

/**
 * Strategy interface for reconciling text and vision attribute candidates into one prediction.
 *
 * <p>Implementations are pure functions of their inputs: no IO, deterministic, and
 * attributes are evaluated in ascending attribute-name order. Fusion never fails a record;
 * an attribute without candidates is simply omitted from both the predictions and the
 * decision log.
 *
 * <p><b>Thread Safety:</b> implementations must be stateless and thread-safe.
 *
 * @see AbstractFusionEngine
 * @see ConfidenceFusionEngine
 */
public interface FusionEngine {

    /**
     * Fuses all candidates produced for one record.
     *
     * @param productId  product identifier copied into the result
     * @param title      product title copied into the result
     * @param candidates candidates from every source, in any order (may be empty)
     * @return prediction whose final predictions and decision log share one key set
     */
    PredictionRecord fuse(String productId, String title, Collection<AttributeCandidate> candidates);
}
