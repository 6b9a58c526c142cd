package com.phillippitts.catalogintel.domain;

/**
 * Identifies what produced a fused attribute value.
 */
public enum ExtractorId {
    TEXT_STUB("text_stub"),
    LLM_STUB("llm_stub"),
    VISION("vision"),
    MERGED("merged"),
    FUSION("fusion");

    private final String wireName;

    ExtractorId(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
