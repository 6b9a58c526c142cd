package com.phillippitts.catalogintel.presentation.dto;

import com.phillippitts.catalogintel.domain.ProductRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound product record. Field names are snake_case on the wire.
 */
public record ProductRecordPayload(
        @NotBlank String productId,
        String imageUrl,
        @NotNull String title,
        String description
) {

    public ProductRecord toDomain() {
        return new ProductRecord(productId, imageUrl, title, description);
    }
}
