package com.phillippitts.catalogintel.domain;

/**
 * Phase of a record's processing where an error can be reported.
 */
public enum PipelineStage {
    ADMISSION("admission"),
    INGEST("ingest"),
    ENRICH("enrich"),
    VISION("vision"),
    FUSE("fuse");

    private final String wireName;

    PipelineStage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
