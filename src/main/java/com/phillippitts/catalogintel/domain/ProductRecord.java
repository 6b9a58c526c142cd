package com.phillippitts.catalogintel.domain;

import java.util.Objects;

/**
 * A catalog product accepted for attribute prediction.
 *
 * @param productId   unique identifier within a batch (never blank)
 * @param imageUrl    optional image reference, {@code null} when the product has no image
 * @param title       product title (empty when absent)
 * @param description product description (empty when absent)
 */
public record ProductRecord(
        String productId,
        String imageUrl,
        String title,
        String description
) {

    public ProductRecord {
        Objects.requireNonNull(productId, "productId must not be null");
        if (productId.isBlank()) {
            throw new IllegalArgumentException("productId must not be blank");
        }
        if (imageUrl != null && imageUrl.isBlank()) {
            imageUrl = null;
        }
        title = title == null ? "" : title;
        description = description == null ? "" : description;
    }

    public static ProductRecord of(String productId, String title, String description) {
        return new ProductRecord(productId, null, title, description);
    }

    public boolean hasImage() {
        return imageUrl != null;
    }

    /**
     * Character count checked by the text-size guardrail.
     */
    public int textLength() {
        return title.length() + description.length();
    }
}
