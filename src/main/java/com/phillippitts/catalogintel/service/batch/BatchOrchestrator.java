package com.phillippitts.catalogintel.service.batch;

import com.phillippitts.catalogintel.domain.BatchResult;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.service.admission.AdmittedBatch;

import java.util.List;

/**
 * Runs the record pipeline over a batch with failure isolation and ordered results.
 */
public interface BatchOrchestrator {

    /**
     * Runs every record; index {@code i} in the result refers to {@code records.get(i)}.
     */
    BatchResult runBatch(List<ProductRecord> records);

    /**
     * Runs the accepted records of an admitted batch and merges in its admission errors.
     */
    BatchResult runBatch(AdmittedBatch batch);
}
