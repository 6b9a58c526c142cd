package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.StageException;
import com.phillippitts.catalogintel.util.Deadline;

/**
 * Runs ingest, enrich, vision and fuse for one admitted record.
 *
 * <p>A failure is reported as a {@link StageException} naming the stage and its error type;
 * no partial prediction is ever returned. Nothing is retried at this layer.
 */
public interface RecordPipeline {

    /**
     * Runs the record under a fresh deadline derived from the configured record timeout.
     *
     * @throws StageException when any stage fails or the deadline passes
     */
    PipelineResult run(ProductRecord record);

    /**
     * Runs the record under an explicit deadline.
     *
     * @throws StageException when any stage fails or the deadline passes
     */
    PipelineResult run(ProductRecord record, Deadline deadline);
}
