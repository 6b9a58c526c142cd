package com.phillippitts.catalogintel.service.extract;

import java.nio.file.Path;

/**
 * Model boundary for image labelling.
 */
public interface VisionLabelProvider {

    /**
     * @param image local image produced by the ingest stage
     * @return labels ordered by descending relevance
     */
    VisionPrediction predict(Path image);
}
