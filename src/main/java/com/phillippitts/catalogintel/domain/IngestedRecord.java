package com.phillippitts.catalogintel.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A product record after the ingest stage resolved its image.
 *
 * @param record    the admitted product
 * @param imagePath local cached image, {@code null} when the product has no image
 */
public record IngestedRecord(ProductRecord record, Path imagePath) {

    public IngestedRecord {
        Objects.requireNonNull(record, "record must not be null");
    }

    public static IngestedRecord withoutImage(ProductRecord record) {
        return new IngestedRecord(record, null);
    }

    public boolean hasImage() {
        return imagePath != null;
    }

    public String productId() {
        return record.productId();
    }
}
