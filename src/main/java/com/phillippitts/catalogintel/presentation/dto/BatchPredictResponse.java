package com.phillippitts.catalogintel.presentation.dto;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.BatchItem;
import com.phillippitts.catalogintel.domain.BatchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch response body: {@code {"items": [...], "errors": [...]}}, both ordered by index.
 */
public record BatchPredictResponse(List<BatchItemResponse> items, List<BatchError> errors) {

    public static BatchPredictResponse from(BatchResult result) {
        List<BatchItemResponse> items = new ArrayList<>(result.items().size());
        for (BatchItem item : result.items()) {
            items.add(BatchItemResponse.from(item));
        }
        return new BatchPredictResponse(List.copyOf(items), result.errors());
    }
}
