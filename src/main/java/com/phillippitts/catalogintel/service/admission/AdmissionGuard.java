package com.phillippitts.catalogintel.service.admission;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.IndexedRecord;
import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.AdmissionErrorType;
import com.phillippitts.catalogintel.exception.AdmissionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates requests against size limits and the shared rate budget before any IO.
 *
 * <p>Checks run in this order: rate limit (one token per request), batch size, duplicate
 * product ids, then per-item text size. Only the text-size check can reject a single batch
 * item while its siblings continue; everything else rejects the whole request.
 */
public class AdmissionGuard {

    private static final Logger LOG = LogManager.getLogger(AdmissionGuard.class);

    private final int maxBatchItems;
    private final int maxTextChars;
    private final TokenBucketRateLimiter rateLimiter;

    /**
     * @param maxBatchItems largest accepted batch
     * @param maxTextChars  largest accepted title + description length per item
     * @param rateLimiter   shared limiter, or {@code null} to disable rate limiting
     */
    public AdmissionGuard(int maxBatchItems, int maxTextChars, TokenBucketRateLimiter rateLimiter) {
        if (maxBatchItems <= 0) {
            throw new IllegalArgumentException("maxBatchItems must be > 0, got: " + maxBatchItems);
        }
        if (maxTextChars <= 0) {
            throw new IllegalArgumentException("maxTextChars must be > 0, got: " + maxTextChars);
        }
        this.maxBatchItems = maxBatchItems;
        this.maxTextChars = maxTextChars;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Admits a single-record request.
     *
     * @throws AdmissionException when rate limited or the record's text is too long
     */
    public ProductRecord admit(ProductRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        consumeToken();
        if (record.textLength() > maxTextChars) {
            throw new AdmissionException(AdmissionErrorType.TEXT_LIMIT_EXCEEDED, record.productId(),
                    textLimitMessage(record));
        }
        return record;
    }

    /**
     * Admits a batch request.
     *
     * @return records cleared for processing plus per-item text-size rejections
     * @throws AdmissionException when rate limited, too large or product ids repeat
     */
    public AdmittedBatch admitBatch(List<ProductRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        consumeToken();
        if (records.size() > maxBatchItems) {
            throw new AdmissionException(AdmissionErrorType.BATCH_LIMIT_EXCEEDED,
                    "Batch of " + records.size() + " items exceeds limit of " + maxBatchItems);
        }
        checkUniqueIds(records);

        List<IndexedRecord> accepted = new ArrayList<>(records.size());
        List<BatchError> rejected = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            ProductRecord record = records.get(i);
            if (record.textLength() > maxTextChars) {
                rejected.add(new BatchError(i, record.productId(), PipelineStage.ADMISSION,
                        AdmissionErrorType.TEXT_LIMIT_EXCEEDED.wireName(), textLimitMessage(record)));
            } else {
                accepted.add(new IndexedRecord(i, record));
            }
        }
        if (!rejected.isEmpty()) {
            LOG.info("Admission excluded {} of {} batch items for text size", rejected.size(), records.size());
        }
        return new AdmittedBatch(accepted, rejected, records.size());
    }

    public int maxBatchItems() {
        return maxBatchItems;
    }

    public int maxTextChars() {
        return maxTextChars;
    }

    /**
     * @return the shared limiter, or {@code null} when rate limiting is disabled
     */
    public TokenBucketRateLimiter rateLimiter() {
        return rateLimiter;
    }

    private void consumeToken() {
        if (rateLimiter != null && !rateLimiter.tryConsume()) {
            throw new AdmissionException(AdmissionErrorType.RATE_LIMITED, "Rate limit exceeded");
        }
    }

    private static void checkUniqueIds(List<ProductRecord> records) {
        Set<String> seen = new HashSet<>();
        for (ProductRecord record : records) {
            if (!seen.add(record.productId())) {
                throw new AdmissionException(AdmissionErrorType.DUPLICATE_PRODUCT_ID, record.productId(),
                        "Duplicate product_id in batch: " + record.productId());
            }
        }
    }

    private String textLimitMessage(ProductRecord record) {
        return "Text length " + record.textLength() + " exceeds limit of " + maxTextChars;
    }
}
