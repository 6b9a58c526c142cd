package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.domain.PredictionRecord;
import org.json.JSONObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds the versioned event envelope published for each prediction.
 */
public class PredictionEventFactory {

    public static final String SOURCE = "catalog-intel.api";
    public static final String VERSION = "v1";

    public JSONObject build(PredictionRecord record) {
        return build(record, UUID.randomUUID().toString(), Instant.now());
    }

    public JSONObject build(PredictionRecord record, String eventId, Instant eventTs) {
        return new JSONObject()
                .put("event_id", eventId)
                .put("event_ts", eventTs.toString())
                .put("source", SOURCE)
                .put("version", VERSION)
                .put("product_id", record.productId())
                .put("predictions", PredictionJson.compactPredictions(record))
                .put("decision_log", PredictionJson.decisionLog(record));
    }
}
