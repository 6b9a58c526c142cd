package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.ConflictEntry;
import com.phillippitts.catalogintel.domain.DecisionLogEntry;
import com.phillippitts.catalogintel.domain.FusedAttribute;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

/**
 * org.json renderings of predictions shared by the publisher envelope and warehouse rows.
 */
final class PredictionJson {

    private PredictionJson() {
    }

    /**
     * {@code {attr: {value, confidence, extracted_by}}}.
     */
    static JSONObject compactPredictions(PredictionRecord record) {
        JSONObject out = new JSONObject();
        for (Map.Entry<String, FusedAttribute> entry : record.finalPredictions().entrySet()) {
            FusedAttribute attr = entry.getValue();
            out.put(entry.getKey(), new JSONObject()
                    .put("value", attr.value())
                    .put("confidence", attr.confidence())
                    .put("extracted_by", attr.extractedBy().toString()));
        }
        return out;
    }

    static JSONObject decisionLog(PredictionRecord record) {
        JSONObject out = new JSONObject();
        for (Map.Entry<String, DecisionLogEntry> entry : record.decisionLog().entrySet()) {
            DecisionLogEntry log = entry.getValue();
            JSONArray sources = new JSONArray();
            for (AttributeSource source : log.sourcesConsidered()) {
                sources.put(source.toString());
            }
            JSONArray conflicts = new JSONArray();
            for (ConflictEntry conflict : log.conflicts()) {
                conflicts.put(new JSONObject()
                        .put("source", conflict.source().toString())
                        .put("value", conflict.value())
                        .put("confidence", conflict.confidence()));
            }
            out.put(entry.getKey(), new JSONObject()
                    .put("sources_considered", sources)
                    .put("chosen_source", log.chosenSource())
                    .put("reason", log.reason())
                    .put("conflicts", conflicts));
        }
        return out;
    }

    /**
     * Full prediction including evidence, as returned by the API.
     */
    static JSONObject fullRecord(PredictionRecord record) {
        JSONObject predictions = new JSONObject();
        for (Map.Entry<String, FusedAttribute> entry : record.finalPredictions().entrySet()) {
            FusedAttribute attr = entry.getValue();
            predictions.put(entry.getKey(), new JSONObject()
                    .put("value", attr.value())
                    .put("confidence", attr.confidence())
                    .put("extracted_by", attr.extractedBy().toString())
                    .put("evidence", new JSONArray(attr.evidence())));
        }
        return new JSONObject()
                .put("product_id", record.productId())
                .put("title", record.title())
                .put("final_predictions", predictions)
                .put("decision_log", decisionLog(record));
    }
}
