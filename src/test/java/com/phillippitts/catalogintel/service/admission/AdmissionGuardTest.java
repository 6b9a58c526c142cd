package com.phillippitts.catalogintel.service.admission;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.IndexedRecord;
import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.AdmissionErrorType;
import com.phillippitts.catalogintel.exception.AdmissionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdmissionGuardTest {

    private static List<ProductRecord> records(int count) {
        List<ProductRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(ProductRecord.of("p" + i, "Title " + i, "Description"));
        }
        return records;
    }

    @Test
    void admitsBatchAtTheLimit() {
        var guard = new AdmissionGuard(50, 10_000, null);

        AdmittedBatch batch = guard.admitBatch(records(50));

        assertThat(batch.accepted()).hasSize(50);
        assertThat(batch.rejected()).isEmpty();
    }

    @Test
    void rejectsBatchOverTheLimitInFull() {
        var guard = new AdmissionGuard(50, 10_000, null);

        assertThatThrownBy(() -> guard.admitBatch(records(51)))
                .isInstanceOfSatisfying(AdmissionException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(AdmissionErrorType.BATCH_LIMIT_EXCEEDED));
    }

    @Test
    void oversizedItemFailsAloneInsideBatch() {
        var guard = new AdmissionGuard(10, 20, null);
        List<ProductRecord> batch = List.of(
                ProductRecord.of("a", "short", ""),
                ProductRecord.of("b", "this title is far too long", "and so is this"),
                ProductRecord.of("c", "fine", "ok"));

        AdmittedBatch admitted = guard.admitBatch(batch);

        assertThat(admitted.accepted()).extracting(IndexedRecord::index).containsExactly(0, 2);
        assertThat(admitted.rejected()).hasSize(1);
        BatchError error = admitted.rejected().get(0);
        assertThat(error.index()).isEqualTo(1);
        assertThat(error.productId()).isEqualTo("b");
        assertThat(error.stage()).isEqualTo(PipelineStage.ADMISSION);
        assertThat(error.errorType()).isEqualTo("text_limit_exceeded");
    }

    @Test
    void textLimitCountsTitlePlusDescription() {
        var guard = new AdmissionGuard(10, 10, null);

        assertThat(guard.admit(ProductRecord.of("a", "12345", "67890"))).isNotNull();
        assertThatThrownBy(() -> guard.admit(ProductRecord.of("b", "12345", "678901")))
                .isInstanceOfSatisfying(AdmissionException.class, e -> {
                    assertThat(e.getErrorType()).isEqualTo(AdmissionErrorType.TEXT_LIMIT_EXCEEDED);
                    assertThat(e.getProductId()).isEqualTo("b");
                });
    }

    @Test
    void duplicateProductIdsRejectTheBatch() {
        var guard = new AdmissionGuard(10, 100, null);
        List<ProductRecord> batch = List.of(
                ProductRecord.of("dup", "a", ""),
                ProductRecord.of("other", "b", ""),
                ProductRecord.of("dup", "c", ""));

        assertThatThrownBy(() -> guard.admitBatch(batch))
                .isInstanceOfSatisfying(AdmissionException.class, e -> {
                    assertThat(e.getErrorType()).isEqualTo(AdmissionErrorType.DUPLICATE_PRODUCT_ID);
                    assertThat(e.getProductId()).isEqualTo("dup");
                });
    }

    @Test
    void rateLimitIsCheckedBeforeSizeAndConsumesOneTokenPerRequest() {
        var limiter = new TokenBucketRateLimiter(1, 0, () -> 0L);
        var guard = new AdmissionGuard(50, 10_000, limiter);

        guard.admitBatch(records(3));

        assertThatThrownBy(() -> guard.admitBatch(records(51)))
                .isInstanceOfSatisfying(AdmissionException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(AdmissionErrorType.RATE_LIMITED));
        assertThatThrownBy(() -> guard.admit(ProductRecord.of("x", "t", "d")))
                .isInstanceOfSatisfying(AdmissionException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(AdmissionErrorType.RATE_LIMITED));
    }

    @Test
    void emptyBatchIsAdmitted() {
        var guard = new AdmissionGuard(50, 10_000, null);

        AdmittedBatch batch = guard.admitBatch(List.of());

        assertThat(batch.accepted()).isEmpty();
        assertThat(batch.requestSize()).isZero();
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new AdmissionGuard(0, 10, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AdmissionGuard(10, 0, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
