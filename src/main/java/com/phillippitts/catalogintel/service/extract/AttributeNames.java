package com.phillippitts.catalogintel.service.extract;

/**
 * Attribute keys produced by the built-in extractors.
 */
public final class AttributeNames {
    public static final String CATEGORY = "category";
    public static final String ROOM_TYPE = "room_type";
    public static final String STYLE = "style";
    public static final String MATERIAL = "material";
    public static final String DIMENSIONS = "dimensions";

    private AttributeNames() {
        // Utility class
    }
}
