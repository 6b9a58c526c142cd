package com.phillippitts.catalogintel.presentation.dto;

import com.phillippitts.catalogintel.domain.BatchItem;
import com.phillippitts.catalogintel.domain.DecisionLogEntry;
import com.phillippitts.catalogintel.domain.FusedAttribute;
import com.phillippitts.catalogintel.domain.PredictionRecord;

import java.util.SortedMap;

/**
 * A successful batch entry: the prediction flattened next to its request index.
 */
public record BatchItemResponse(
        int index,
        String productId,
        String title,
        SortedMap<String, FusedAttribute> finalPredictions,
        SortedMap<String, DecisionLogEntry> decisionLog
) {

    public static BatchItemResponse from(BatchItem item) {
        PredictionRecord prediction = item.prediction();
        return new BatchItemResponse(item.index(), prediction.productId(), prediction.title(),
                prediction.finalPredictions(), prediction.decisionLog());
    }
}
