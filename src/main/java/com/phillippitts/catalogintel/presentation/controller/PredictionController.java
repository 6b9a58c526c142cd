package com.phillippitts.catalogintel.presentation.controller;

import com.phillippitts.catalogintel.domain.BatchResult;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.presentation.dto.BatchPredictRequest;
import com.phillippitts.catalogintel.presentation.dto.BatchPredictResponse;
import com.phillippitts.catalogintel.presentation.dto.ProductRecordPayload;
import com.phillippitts.catalogintel.service.orchestration.CatalogPredictionService;
import com.phillippitts.catalogintel.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prediction endpoints. Errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/v1/predict")
class PredictionController {

    private static final Logger LOG = LogManager.getLogger(PredictionController.class);

    private final CatalogPredictionService predictionService;

    PredictionController(CatalogPredictionService predictionService) {
        this.predictionService = predictionService;
    }

    @PostMapping
    ResponseEntity<PredictionRecord> predict(@Valid @RequestBody ProductRecordPayload payload) {
        LOG.debug("Predict request product={} title='{}'",
                payload.productId(), LogSanitizer.preview(payload.title()));
        return ResponseEntity.ok(predictionService.predictOne(payload.toDomain()));
    }

    @PostMapping("/batch")
    ResponseEntity<BatchPredictResponse> predictBatch(@Valid @RequestBody BatchPredictRequest request) {
        LOG.debug("Batch predict request items={}", request.items().size());
        BatchResult result = predictionService.predictBatch(request.toDomain());
        return ResponseEntity.ok(BatchPredictResponse.from(result));
    }
}
