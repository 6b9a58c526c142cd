package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.domain.FusedAttribute;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.service.extract.AttributeNames;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a prediction into one warehouse row. Missing attributes become null columns.
 */
public class PredictionRowFlattener {

    static final List<String> ATTRIBUTE_COLUMNS = List.of(
            AttributeNames.CATEGORY, AttributeNames.ROOM_TYPE, AttributeNames.STYLE, AttributeNames.MATERIAL);

    /**
     * Column order: event_id, event_ts, product_id, {attr}_value, {attr}_confidence..., raw_payload.
     */
    public Map<String, Object> flatten(PredictionRecord record, String eventId, Instant eventTs) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event_id", eventId);
        row.put("event_ts", eventTs.toString());
        row.put("product_id", record.productId());
        for (String attribute : ATTRIBUTE_COLUMNS) {
            FusedAttribute attr = record.finalPredictions().get(attribute);
            row.put(attribute + "_value", attr == null ? null : attr.value());
            row.put(attribute + "_confidence", attr == null ? null : attr.confidence());
        }
        row.put("raw_payload", PredictionJson.fullRecord(record).toString());
        return row;
    }
}
