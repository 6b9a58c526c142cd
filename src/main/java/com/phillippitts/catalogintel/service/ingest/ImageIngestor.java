package com.phillippitts.catalogintel.service.ingest;

import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.IngestException;
import com.phillippitts.catalogintel.util.Deadline;

/**
 * Resolves and caches a product's image ahead of the vision stage.
 *
 * <p>Implementations must honor the deadline and respond to thread interruption, which is
 * how the record pipeline cancels an overdue stage. Retries, if any, belong here.
 */
public interface ImageIngestor {

    /**
     * @param record   admitted product
     * @param deadline record deadline
     * @return the record with its local image, or with none when it has no image reference
     * @throws IngestException classified as fetch_failed, timeout or unsupported_format
     */
    IngestedRecord ingest(ProductRecord record, Deadline deadline);
}
