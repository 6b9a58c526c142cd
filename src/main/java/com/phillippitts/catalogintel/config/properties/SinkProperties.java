package com.phillippitts.catalogintel.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Output sink switches and locations. Both sinks are off by default.
 */
@Validated
@ConfigurationProperties(prefix = "catalog.sinks")
public class SinkProperties {

    private final boolean publishEnabled;
    private final String eventsDir;
    private final String topic;
    private final boolean validateEvents;
    private final boolean warehouseEnabled;
    private final String warehouseDir;

    @ConstructorBinding
    public SinkProperties(Boolean publishEnabled, String eventsDir, String topic, Boolean validateEvents,
                          Boolean warehouseEnabled, String warehouseDir) {
        this.publishEnabled = publishEnabled != null && publishEnabled;
        this.eventsDir = blankToDefault(eventsDir, "outputs/events");
        this.topic = blankToDefault(topic, "catalog_predictions");
        if (!this.topic.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("catalog.sinks.topic must be a plain file-safe name");
        }
        this.validateEvents = validateEvents != null && validateEvents;
        this.warehouseEnabled = warehouseEnabled != null && warehouseEnabled;
        this.warehouseDir = blankToDefault(warehouseDir, "outputs/warehouse");
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public boolean isPublishEnabled() {
        return publishEnabled;
    }

    public String getEventsDir() {
        return eventsDir;
    }

    public String getTopic() {
        return topic;
    }

    public boolean isValidateEvents() {
        return validateEvents;
    }

    public boolean isWarehouseEnabled() {
        return warehouseEnabled;
    }

    public String getWarehouseDir() {
        return warehouseDir;
    }
}
