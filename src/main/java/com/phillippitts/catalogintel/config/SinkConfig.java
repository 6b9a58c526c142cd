package com.phillippitts.catalogintel.config;

import com.phillippitts.catalogintel.config.properties.SinkProperties;
import com.phillippitts.catalogintel.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.catalogintel.service.sink.LocalCsvWarehouseSink;
import com.phillippitts.catalogintel.service.sink.LocalFilePublisher;
import com.phillippitts.catalogintel.service.sink.PredictionEventValidator;
import com.phillippitts.catalogintel.service.sink.PredictionOutputListener;
import com.phillippitts.catalogintel.service.sink.PredictionPublisher;
import com.phillippitts.catalogintel.service.sink.WarehouseSink;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Output sinks. Each sink exists only when switched on; the listener always exists and
 * skips sinks that are absent.
 */
@Configuration
public class SinkConfig {

    @Bean
    @ConditionalOnProperty(prefix = "catalog.sinks", name = "publish-enabled", havingValue = "true")
    public PredictionPublisher predictionPublisher(SinkProperties properties) {
        return new LocalFilePublisher(Paths.get(properties.getEventsDir()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "catalog.sinks", name = "warehouse-enabled", havingValue = "true")
    public WarehouseSink warehouseSink(SinkProperties properties) {
        return new LocalCsvWarehouseSink(Paths.get(properties.getWarehouseDir()));
    }

    @Bean
    public PredictionOutputListener predictionOutputListener(SinkProperties properties,
                                                             ObjectProvider<PredictionPublisher> publisher,
                                                             ObjectProvider<WarehouseSink> warehouse,
                                                             PipelineMetricsPublisher metricsPublisher) {
        PredictionEventValidator validator = properties.isValidateEvents() ? new PredictionEventValidator() : null;
        return new PredictionOutputListener(publisher.getIfAvailable(), validator, warehouse.getIfAvailable(),
                properties.getTopic(), metricsPublisher);
    }
}
