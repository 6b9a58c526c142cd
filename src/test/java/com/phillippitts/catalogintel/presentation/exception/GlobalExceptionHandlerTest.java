package com.phillippitts.catalogintel.presentation.exception;

import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.exception.AdmissionErrorType;
import com.phillippitts.catalogintel.exception.AdmissionException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.exception.StageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void rateLimitedReturns429() {
        ResponseEntity<?> response = handler.handleAdmission(
                new AdmissionException(AdmissionErrorType.RATE_LIMITED, "Rate limit exceeded"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody().toString()).contains("rate_limited");
    }

    @Test
    void sizeLimitsReturn413() {
        ResponseEntity<?> batch = handler.handleAdmission(
                new AdmissionException(AdmissionErrorType.BATCH_LIMIT_EXCEEDED, "Batch of 51 items exceeds limit of 50"));
        ResponseEntity<?> text = handler.handleAdmission(
                new AdmissionException(AdmissionErrorType.TEXT_LIMIT_EXCEEDED, "sku-1", "too long"));

        assertThat(batch.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(text.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(text.getBody().toString()).contains("sku-1");
    }

    @Test
    void duplicateIdsReturn400() {
        ResponseEntity<?> response = handler.handleAdmission(
                new AdmissionException(AdmissionErrorType.DUPLICATE_PRODUCT_ID, "a", "Duplicate product_id 'a'"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("duplicate_product_id");
    }

    @Test
    void stageFailureReturns422WithStageAndType() {
        StageException ex = new StageException("sku-7", PipelineStage.VISION, StageErrorType.TIMEOUT,
                "Stage exceeded record deadline");

        ResponseEntity<?> response = handler.handleStage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        String body = response.getBody().toString();
        assertThat(body).contains("productId=sku-7");
        assertThat(body).contains("errorType=timeout");
        assertThat(body).contains("stage=vision");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<?> response = handler.handleUnexpected(
                new IllegalStateException("secret at /srv/internal/cache"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        String body = response.getBody().toString();
        assertThat(body).contains("internal_error");
        assertThat(body).doesNotContain("/srv/internal");
        assertThat(body).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }

    @Test
    void mapsEveryAdmissionType() {
        for (AdmissionErrorType type : AdmissionErrorType.values()) {
            assertThat(GlobalExceptionHandler.statusFor(type)).isNotNull();
        }
    }
}
