package com.phillippitts.catalogintel.service.admission;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.IndexedRecord;

import java.util.List;

/**
 * Outcome of admitting a batch: records cleared for processing plus items refused individually.
 *
 * @param accepted    records to run, in request order
 * @param rejected    per-item admission errors, in request order
 * @param requestSize number of items in the original request
 */
public record AdmittedBatch(List<IndexedRecord> accepted, List<BatchError> rejected, int requestSize) {

    public AdmittedBatch {
        accepted = accepted == null ? List.of() : List.copyOf(accepted);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
        if (accepted.size() + rejected.size() != requestSize) {
            throw new IllegalArgumentException("accepted + rejected must cover all " + requestSize + " items");
        }
    }
}
