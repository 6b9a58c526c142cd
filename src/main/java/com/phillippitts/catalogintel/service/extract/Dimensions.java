package com.phillippitts.catalogintel.service.extract;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Width, depth and height parsed from product text. Absent axes are null.
 *
 * @param evidence matched text the values came from
 */
public record Dimensions(Double width, Double depth, Double height, String unit, String evidence) {

    public int axisCount() {
        int count = 0;
        if (width != null) {
            count++;
        }
        if (depth != null) {
            count++;
        }
        if (height != null) {
            count++;
        }
        return count;
    }

    /**
     * 0.95 for three axes, 0.85 for two, 0.75 for one.
     */
    public double confidence() {
        int axes = axisCount();
        return axes >= 3 ? 0.95 : axes == 2 ? 0.85 : 0.75;
    }

    /**
     * Present axes joined as {@code "60 x 30 x 18 in"}.
     */
    public String display() {
        List<String> parts = new ArrayList<>(3);
        for (Double axis : new Double[] {width, depth, height}) {
            if (axis != null) {
                parts.add(BigDecimal.valueOf(axis).stripTrailingZeros().toPlainString());
            }
        }
        String joined = String.join(" x ", parts);
        return unit == null ? joined : joined + " " + unit;
    }
}
