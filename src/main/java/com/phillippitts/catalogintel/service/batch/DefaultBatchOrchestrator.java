package com.phillippitts.catalogintel.service.batch;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.BatchItem;
import com.phillippitts.catalogintel.domain.BatchResult;
import com.phillippitts.catalogintel.domain.IndexedRecord;
import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.domain.StageTimings;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.exception.StageException;
import com.phillippitts.catalogintel.service.admission.AdmittedBatch;
import com.phillippitts.catalogintel.service.pipeline.PipelineResult;
import com.phillippitts.catalogintel.service.pipeline.RecordPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatches each record to the pipeline on the bounded record executor.
 *
 * <p><b>Failure Isolation:</b> a record's failure becomes a {@link BatchError} at its index
 * and never affects siblings; each record gets its own deadline.
 *
 * <p><b>Ordering:</b> completion order is unconstrained, but items and errors are returned
 * sorted by request index, so the result does not depend on the pool size.
 */
public class DefaultBatchOrchestrator implements BatchOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultBatchOrchestrator.class);

    private final RecordPipeline pipeline;
    private final Executor recordExecutor;

    public DefaultBatchOrchestrator(RecordPipeline pipeline, Executor recordExecutor) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.recordExecutor = Objects.requireNonNull(recordExecutor, "recordExecutor must not be null");
    }

    @Override
    public BatchResult runBatch(List<ProductRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<IndexedRecord> indexed = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            indexed.add(new IndexedRecord(i, records.get(i)));
        }
        return runBatch(new AdmittedBatch(indexed, List.of(), records.size()));
    }

    @Override
    public BatchResult runBatch(AdmittedBatch batch) {
        Objects.requireNonNull(batch, "batch must not be null");

        List<CompletableFuture<RecordOutcome>> futures = new ArrayList<>(batch.accepted().size());
        for (IndexedRecord indexed : batch.accepted()) {
            futures.add(dispatch(indexed));
        }

        List<BatchItem> items = new ArrayList<>(futures.size());
        List<BatchError> errors = new ArrayList<>(batch.rejected());
        StageTimings timings = StageTimings.empty();
        for (int i = 0; i < futures.size(); i++) {
            RecordOutcome outcome = await(futures.get(i), batch.accepted().get(i));
            if (outcome.error() != null) {
                errors.add(outcome.error());
            } else {
                items.add(new BatchItem(outcome.index(), outcome.result().prediction()));
                timings = timings.plus(outcome.result().timings());
            }
        }

        BatchResult result = new BatchResult(items, errors, timings);
        if (result.size() != batch.requestSize()) {
            throw new IllegalStateException("Batch result covers " + result.size()
                    + " of " + batch.requestSize() + " items");
        }
        LOG.debug("Batch finished: {} items, {} errors", items.size(), errors.size());
        return result;
    }

    private CompletableFuture<RecordOutcome> dispatch(IndexedRecord indexed) {
        try {
            return CompletableFuture.supplyAsync(() -> runOne(indexed), recordExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(unexpected(indexed, e));
        }
    }

    private RecordOutcome runOne(IndexedRecord indexed) {
        try {
            return new RecordOutcome(indexed.index(), pipeline.run(indexed.record()), null);
        } catch (StageException e) {
            return new RecordOutcome(indexed.index(), null, e.toBatchError(indexed.index()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected pipeline error for index {}", indexed.index(), e);
            return unexpected(indexed, e);
        }
    }

    private static RecordOutcome await(CompletableFuture<RecordOutcome> future, IndexedRecord indexed) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Record task for index {} failed", indexed.index(), cause);
            return unexpected(indexed, cause);
        }
    }

    // Reported against ingest, the first stage a record enters.
    private static RecordOutcome unexpected(IndexedRecord indexed, Throwable cause) {
        BatchError error = new BatchError(indexed.index(), indexed.record().productId(), PipelineStage.INGEST,
                StageErrorType.STAGE_FAILURE.wireName(), String.valueOf(cause.getMessage()));
        return new RecordOutcome(indexed.index(), null, error);
    }

    private record RecordOutcome(int index, PipelineResult result, BatchError error) {
    }
}
