package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.exception.SinkException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Structural checks on an event envelope before it is published.
 */
public class PredictionEventValidator {

    private static final String[] REQUIRED_STRINGS = {"event_id", "event_ts", "source", "version", "product_id"};

    /**
     * @throws SinkException naming the first violation found
     */
    public void validate(JSONObject event) {
        for (String field : REQUIRED_STRINGS) {
            Object value = event.opt(field);
            if (!(value instanceof String) || ((String) value).isBlank()) {
                throw invalid("'" + field + "' must be a non-empty string");
            }
        }
        try {
            Instant.parse(event.getString("event_ts"));
        } catch (DateTimeParseException e) {
            throw new SinkException("Event payload failed validation: 'event_ts' is not an ISO-8601 instant", e);
        }
        if (!PredictionEventFactory.VERSION.equals(event.getString("version"))) {
            throw invalid("unsupported version '" + event.getString("version") + "'");
        }

        JSONObject predictions = event.optJSONObject("predictions");
        if (predictions == null) {
            throw invalid("'predictions' must be an object");
        }
        for (String attribute : predictions.keySet()) {
            JSONObject attr = predictions.optJSONObject(attribute);
            if (attr == null || !attr.has("value") || !attr.has("extracted_by")) {
                throw invalid("prediction '" + attribute + "' must have value and extracted_by");
            }
            double confidence = attr.optDouble("confidence", Double.NaN);
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw invalid("prediction '" + attribute + "' confidence must be within [0,1]");
            }
        }

        JSONObject decisionLog = event.optJSONObject("decision_log");
        if (decisionLog == null) {
            throw invalid("'decision_log' must be an object");
        }
        if (!decisionLog.keySet().equals(predictions.keySet())) {
            throw invalid("'decision_log' keys must match 'predictions' keys");
        }
    }

    private static SinkException invalid(String detail) {
        return new SinkException("Event payload failed validation: " + detail);
    }
}
