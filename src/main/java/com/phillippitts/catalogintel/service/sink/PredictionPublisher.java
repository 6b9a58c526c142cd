package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.exception.SinkException;
import org.json.JSONObject;

/**
 * Append-only topic publisher.
 */
public interface PredictionPublisher {

    /**
     * @return message identifier assigned to the published payload
     * @throws SinkException when the message cannot be delivered
     */
    String publish(String topic, JSONObject message);
}
