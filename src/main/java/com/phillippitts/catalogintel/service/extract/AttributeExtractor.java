package com.phillippitts.catalogintel.service.extract;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.exception.ExtractionException;
import com.phillippitts.catalogintel.util.Deadline;

import java.util.List;

/**
 * A pluggable signal source proposing attribute values for one record.
 *
 * <p>Implementations are deterministic and side-effect free. Fusion only looks at
 * {@link AttributeCandidate#source()}, so any extractor reporting the same source is
 * interchangeable.
 */
public interface AttributeExtractor {

    /**
     * Source stamped on every candidate this extractor returns.
     */
    AttributeSource source();

    /**
     * @param record   ingested record
     * @param deadline record deadline, to be honored by long-running implementations
     * @return zero or more candidates, at most one per attribute name
     * @throws ExtractionException classified as malformed_input or unreachable_resource
     */
    List<AttributeCandidate> extract(IngestedRecord record, Deadline deadline);
}
