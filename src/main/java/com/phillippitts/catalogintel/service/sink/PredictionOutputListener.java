package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.exception.SinkException;
import com.phillippitts.catalogintel.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.catalogintel.service.orchestration.event.PredictionsCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Delivers completed predictions to the publisher and warehouse sinks off the request thread.
 *
 * <p>Each sink is optional. Delivery failures are logged and counted; they never reach the
 * caller that produced the predictions. A failed publish does not stop the warehouse write.
 */
public class PredictionOutputListener {

    private static final Logger LOG = LogManager.getLogger(PredictionOutputListener.class);

    static final String WAREHOUSE_DATASET = "catalog";
    static final String WAREHOUSE_TABLE = "predictions";
    static final String PUBLISHER_SINK = "publisher";
    static final String WAREHOUSE_SINK = "warehouse";

    private final PredictionPublisher publisher;
    private final PredictionEventValidator validator;
    private final WarehouseSink warehouse;
    private final String topic;
    private final PredictionEventFactory eventFactory;
    private final PredictionRowFlattener flattener;
    private final PipelineMetricsPublisher metricsPublisher;

    /**
     * @param publisher publisher, or {@code null} when publishing is disabled
     * @param validator envelope validator, or {@code null} when validation is disabled
     * @param warehouse warehouse sink, or {@code null} when disabled
     */
    public PredictionOutputListener(PredictionPublisher publisher,
                                    PredictionEventValidator validator,
                                    WarehouseSink warehouse,
                                    String topic,
                                    PipelineMetricsPublisher metricsPublisher) {
        this.publisher = publisher;
        this.validator = validator;
        this.warehouse = warehouse;
        this.topic = topic;
        this.eventFactory = new PredictionEventFactory();
        this.flattener = new PredictionRowFlattener();
        this.metricsPublisher = metricsPublisher != null ? metricsPublisher : PipelineMetricsPublisher.NOOP;
    }

    @Async("eventExecutor")
    @EventListener
    public void onPredictionsCompleted(PredictionsCompletedEvent event) {
        deliver(event.predictions());
    }

    /**
     * Publishes and stores the predictions; returns the number of messages published.
     */
    int deliver(List<PredictionRecord> predictions) {
        if (predictions.isEmpty() || (publisher == null && warehouse == null)) {
            return 0;
        }

        int published = 0;
        List<Map<String, Object>> rows = new ArrayList<>(predictions.size());
        for (PredictionRecord prediction : predictions) {
            String eventId = UUID.randomUUID().toString();
            Instant eventTs = Instant.now();
            if (publisher != null && publish(prediction, eventId, eventTs)) {
                published++;
            }
            if (warehouse != null) {
                rows.add(flattener.flatten(prediction, eventId, eventTs));
            }
        }

        if (warehouse != null) {
            try {
                warehouse.writeRows(WAREHOUSE_DATASET, WAREHOUSE_TABLE, rows);
            } catch (SinkException e) {
                LOG.warn("Warehouse write of {} rows failed: {}", rows.size(), e.getMessage());
                metricsPublisher.recordSinkFailure(WAREHOUSE_SINK);
            }
        }
        LOG.debug("Delivered {} predictions ({} published, {} warehouse rows)",
                predictions.size(), published, rows.size());
        return published;
    }

    private boolean publish(PredictionRecord prediction, String eventId, Instant eventTs) {
        try {
            JSONObject envelope = eventFactory.build(prediction, eventId, eventTs);
            if (validator != null) {
                validator.validate(envelope);
            }
            String messageId = publisher.publish(topic, envelope);
            LOG.debug("Published {} to {} as {}", prediction.productId(), topic, messageId);
            return true;
        } catch (SinkException e) {
            LOG.warn("Publishing {} failed: {}", prediction.productId(), e.getMessage());
            metricsPublisher.recordSinkFailure(PUBLISHER_SINK);
            return false;
        }
    }
}
