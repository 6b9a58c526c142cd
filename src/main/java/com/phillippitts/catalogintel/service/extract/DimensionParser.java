package com.phillippitts.catalogintel.service.extract;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds dimension patterns such as {@code 60 x 30 x 18 in} or {@code W: 20in D: 18in H: 30in}.
 *
 * <p>Every match in description and title is scored by axis count (plus one when a unit is
 * known). The best score wins; ties prefer the description, then the earliest position.
 */
public class DimensionParser {

    private static final String UNIT = "cm|mm|m|in|inch|inches|ft|feet";
    private static final String NUMBER = "\\d+(?:\\.\\d+)?";
    private static final String TIMES = "(?:x|×)";
    private static final String QUOTE = "[\"”]?";

    private static final Pattern AXIS_PATTERN = Pattern.compile(
            "(?<w>" + NUMBER + ")\\s*(?<unitW>" + UNIT + ")?\\s*(?:" + QUOTE + "\\s*(?:w|width))?\\s*" + TIMES + "\\s*"
                    + "(?<d>" + NUMBER + ")\\s*(?<unitD>" + UNIT + ")?\\s*(?:" + QUOTE + "\\s*(?:d|depth))?"
                    + "(?:\\s*" + TIMES + "\\s*(?<h>" + NUMBER + ")\\s*(?<unitH>" + UNIT + ")?\\s*(?:"
                    + QUOTE + "\\s*(?:h|height))?)?"
                    + "\\s*(?<trailingUnit>" + UNIT + ")?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern LABEL_PATTERN = Pattern.compile(
            "\\b(?<label>width|depth|height|w|d|h)\\s*(?:[:=]\\s*)?(?<value>" + NUMBER + ")(?:\\s*(?<unit>" + UNIT + "))?",
            Pattern.CASE_INSENSITIVE);

    /**
     * @return the best dimensions found, or empty when neither text mentions any
     */
    public Optional<Dimensions> parse(String title, String description) {
        List<String> sources = new ArrayList<>(2);
        if (description != null && !description.isEmpty()) {
            sources.add(description);
        }
        if (title != null && !title.isEmpty()) {
            sources.add(title);
        }

        List<Scored> found = new ArrayList<>();
        for (int i = 0; i < sources.size(); i++) {
            findAxisMatches(sources.get(i), i, found);
            findLabelMatches(sources.get(i), i, found);
        }
        return found.stream()
                .max(Comparator.comparingInt(Scored::score)
                        .thenComparing(Comparator.comparingInt(Scored::sourceIndex).reversed())
                        .thenComparing(Comparator.comparingInt(Scored::position).reversed()))
                .map(Scored::dimensions);
    }

    private static void findAxisMatches(String text, int sourceIndex, List<Scored> out) {
        Matcher m = AXIS_PATTERN.matcher(text);
        while (m.find()) {
            Double w = parse(m.group("w"));
            Double d = parse(m.group("d"));
            Double h = parse(m.group("h"));
            if (isZeroOrNull(w) && isZeroOrNull(d) && isZeroOrNull(h)) {
                continue;
            }
            String unit = firstUnit(m, m.group(0));
            Dimensions dims = new Dimensions(w, d, h, unit, m.group(0).strip());
            out.add(new Scored(dims, sourceIndex, m.start()));
        }
    }

    private static void findLabelMatches(String text, int sourceIndex, List<Scored> out) {
        Matcher m = LABEL_PATTERN.matcher(text);
        LabelRun run = new LabelRun();
        while (m.find()) {
            char label = Character.toLowerCase(m.group("label").charAt(0));
            if (run.seen(label)) {
                run.flush(text, m.start(), sourceIndex, out);
                run = new LabelRun();
            }
            run.add(label, parse(m.group("value")), normalizeUnit(m.group("unit")), m.start(), m.end());
        }
        run.flush(text, run.end, sourceIndex, out);
    }

    private static String firstUnit(Matcher m, String matched) {
        for (String group : new String[] {"trailingUnit", "unitW", "unitD", "unitH"}) {
            String unit = normalizeUnit(m.group(group));
            if (unit != null) {
                return unit;
            }
        }
        if (matched.indexOf('"') >= 0 || matched.indexOf('”') >= 0) {
            return "in";
        }
        if (matched.indexOf('\'') >= 0) {
            return "ft";
        }
        return null;
    }

    static String normalizeUnit(String unit) {
        if (unit == null || unit.isEmpty()) {
            return null;
        }
        String lower = unit.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "inch":
            case "inches":
                return "in";
            case "feet":
            case "foot":
                return "ft";
            default:
                return lower;
        }
    }

    private static Double parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isZeroOrNull(Double value) {
        return value == null || value == 0.0;
    }

    private record Scored(Dimensions dimensions, int sourceIndex, int position) {
        int score() {
            return dimensions.axisCount() * 10 + (dimensions.unit() != null ? 1 : 0);
        }
    }

    /** Consecutive labelled values, one per axis letter. */
    private static final class LabelRun {
        private Double width;
        private Double depth;
        private Double height;
        private String unit;
        private int start = -1;
        private int end = -1;
        private final StringBuilder labels = new StringBuilder();

        boolean seen(char label) {
            return labels.indexOf(String.valueOf(label)) >= 0;
        }

        void add(char label, Double value, String valueUnit, int matchStart, int matchEnd) {
            if (start < 0) {
                start = matchStart;
            }
            end = matchEnd;
            labels.append(label);
            if (value == null) {
                return;
            }
            if (label == 'w' && width == null) {
                width = value;
            } else if (label == 'd' && depth == null) {
                depth = value;
            } else if (label == 'h' && height == null) {
                height = value;
            }
            if (unit == null && valueUnit != null) {
                unit = valueUnit;
            }
        }

        void flush(String text, int endIndex, int sourceIndex, List<Scored> out) {
            Dimensions dims = new Dimensions(width, depth, height, unit, "");
            if (start < 0 || dims.axisCount() < 2) {
                return;
            }
            String evidence = text.substring(start, endIndex).strip();
            out.add(new Scored(new Dimensions(width, depth, height, unit, evidence), sourceIndex, start));
        }
    }
}
