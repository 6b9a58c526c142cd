package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.exception.ExtractionException;
import com.phillippitts.catalogintel.exception.IngestException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.exception.StageException;
import com.phillippitts.catalogintel.exception.StageExceptionBuilder;
import com.phillippitts.catalogintel.util.Deadline;
import com.phillippitts.catalogintel.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one stage call under the record deadline and turns every failure into a
 * {@link StageException}.
 *
 * <p>The deadline is checked before the call starts and again after it returns. While
 * waiting, an overdue call is cancelled with interruption and its result discarded.
 */
public class StageRunner {

    private static final Logger LOG = LogManager.getLogger(StageRunner.class);

    private final Executor stageExecutor;

    public StageRunner(Executor stageExecutor) {
        this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor must not be null");
    }

    /**
     * Runs {@code work} on the stage executor and waits at most until the deadline.
     */
    public <T> T run(PipelineStage stage, String productId, Deadline deadline, Callable<T> work) {
        checkNotExpired(stage, productId, deadline);

        FutureTask<T> task = new FutureTask<>(work);
        long start = System.nanoTime();
        try {
            stageExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            throw failure(stage, productId, StageErrorType.STAGE_FAILURE, "Stage executor rejected work", e);
        }

        T value;
        try {
            value = deadline.isBounded()
                    ? task.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS)
                    : task.get();
        } catch (TimeoutException | CancellationException e) {
            task.cancel(true);
            LOG.warn("Stage {} for {} cancelled after {} ms: record deadline exceeded",
                    stage, productId, TimeUtils.elapsedMillis(start));
            throw StageExceptionBuilder.create("Stage exceeded record deadline")
                    .product(productId)
                    .stage(stage)
                    .errorType(StageErrorType.TIMEOUT)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw failure(stage, productId, StageErrorType.STAGE_FAILURE, "Interrupted while waiting for stage", e);
        } catch (ExecutionException e) {
            throw classify(stage, productId, e.getCause() != null ? e.getCause() : e);
        }

        checkFinishedInTime(stage, productId, deadline, start);
        return value;
    }

    /**
     * Runs non-suspending work on the calling thread after a deadline check.
     */
    public <T> T runInline(PipelineStage stage, String productId, Deadline deadline, Supplier<T> work) {
        checkNotExpired(stage, productId, deadline);
        try {
            return work.get();
        } catch (RuntimeException e) {
            throw classify(stage, productId, e);
        }
    }

    /**
     * Maps a stage's own exception to a stage error. Unknown runtime errors become stage_failure.
     */
    static StageException classify(PipelineStage stage, String productId, Throwable cause) {
        if (cause instanceof StageException se) {
            return se;
        }
        if (cause instanceof IngestException ie) {
            return failure(stage, productId, ie.getErrorType(), ie.getMessage(), ie);
        }
        if (cause instanceof ExtractionException ee) {
            return failure(stage, productId, ee.getErrorType(), ee.getMessage(), ee);
        }
        if (cause instanceof IllegalArgumentException) {
            return failure(stage, productId, StageErrorType.MALFORMED_INPUT, cause.getMessage(), cause);
        }
        LOG.error("Unexpected error in stage {} for {}", stage, productId, cause);
        return failure(stage, productId, StageErrorType.STAGE_FAILURE,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    private static void checkNotExpired(PipelineStage stage, String productId, Deadline deadline) {
        if (deadline.isExpired()) {
            throw StageExceptionBuilder.create("Record deadline exceeded before stage started")
                    .product(productId)
                    .stage(stage)
                    .errorType(StageErrorType.TIMEOUT)
                    .build();
        }
    }

    // Covers executors that run the work on the calling thread.
    private static void checkFinishedInTime(PipelineStage stage, String productId, Deadline deadline, long start) {
        if (deadline.isExpired()) {
            throw StageExceptionBuilder.create("Stage finished after record deadline")
                    .product(productId)
                    .stage(stage)
                    .errorType(StageErrorType.TIMEOUT)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
    }

    private static StageException failure(PipelineStage stage, String productId, StageErrorType type,
                                           String message, Throwable cause) {
        return new StageException(productId, stage, type,
                message == null ? type.wireName() : message, cause);
    }
}
