package com.phillippitts.catalogintel.domain;

/**
 * Signal source that produced an attribute candidate.
 *
 * <p>Declaration order is the evaluation order used for tie-breaks: text wins over vision.
 */
public enum AttributeSource {
    TEXT("text", ExtractorId.TEXT_STUB),
    VISION("vision", ExtractorId.VISION);

    private final String wireName;
    private final ExtractorId stubId;

    AttributeSource(String wireName, ExtractorId stubId) {
        this.wireName = wireName;
        this.stubId = stubId;
    }

    /**
     * Extractor identifier reported when this source alone decides an attribute.
     */
    public ExtractorId stubId() {
        return stubId;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
