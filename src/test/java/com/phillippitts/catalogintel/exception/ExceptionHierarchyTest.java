package com.phillippitts.catalogintel.exception;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.PipelineStage;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsShareBaseType() {
        assertThat(new AdmissionException(AdmissionErrorType.RATE_LIMITED, "x")).isInstanceOf(CatalogIntelException.class);
        assertThat(new IngestException(StageErrorType.FETCH_FAILED, "x")).isInstanceOf(CatalogIntelException.class);
        assertThat(new ExtractionException(StageErrorType.MALFORMED_INPUT, "x")).isInstanceOf(CatalogIntelException.class);
        assertThat(new SinkException("x")).isInstanceOf(CatalogIntelException.class);
    }

    @Test
    void stageExceptionConvertsToBatchError() {
        StageException ex = new StageException("sku-1", PipelineStage.ENRICH, StageErrorType.MALFORMED_INPUT,
                "bad dimensions");

        BatchError error = ex.toBatchError(4);

        assertThat(error.index()).isEqualTo(4);
        assertThat(error.productId()).isEqualTo("sku-1");
        assertThat(error.stage()).isEqualTo(PipelineStage.ENRICH);
        assertThat(error.errorType()).isEqualTo("malformed_input");
        assertThat(error.message()).isEqualTo("bad dimensions");
    }

    @Test
    void builderFormatsDurationAndMetadata() {
        IOException cause = new IOException("reset");
        StageException ex = StageExceptionBuilder.create("Stage exceeded record deadline")
                .product("sku-1")
                .stage(PipelineStage.VISION)
                .errorType(StageErrorType.TIMEOUT)
                .durationMs(8004)
                .metadata("remainingMs", 0)
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage()).isEqualTo("Stage exceeded record deadline (durationMs=8004, remainingMs=0)");
        assertThat(ex.getErrorType()).isEqualTo(StageErrorType.TIMEOUT);
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void builderDefaultsToStageFailureAndRequiresStage() {
        StageException ex = StageExceptionBuilder.create("boom").stage(PipelineStage.FUSE).build();

        assertThat(ex.getErrorType()).isEqualTo(StageErrorType.STAGE_FAILURE);
        assertThat(ex.getMessage()).isEqualTo("boom");
        assertThatThrownBy(() -> StageExceptionBuilder.create("boom").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> StageExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wireNamesAreSnakeCase() {
        for (StageErrorType type : StageErrorType.values()) {
            assertThat(type.wireName()).matches("[a-z_]+");
        }
        assertThat(AdmissionErrorType.BATCH_LIMIT_EXCEEDED.toString()).isEqualTo("batch_limit_exceeded");
    }
}
