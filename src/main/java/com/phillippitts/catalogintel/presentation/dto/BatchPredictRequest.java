package com.phillippitts.catalogintel.presentation.dto;

import com.phillippitts.catalogintel.domain.ProductRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch request body: {@code {"items": [...]}}.
 */
public record BatchPredictRequest(@NotNull @Valid List<@NotNull ProductRecordPayload> items) {

    public List<ProductRecord> toDomain() {
        List<ProductRecord> records = new ArrayList<>(items.size());
        for (ProductRecordPayload item : items) {
            records.add(item.toDomain());
        }
        return records;
    }
}
