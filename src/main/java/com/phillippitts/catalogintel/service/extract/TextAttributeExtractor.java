package com.phillippitts.catalogintel.service.extract;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.ExtractionException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.util.Deadline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule-based extractor reading title and description.
 *
 * <p>For each attribute the phrase table is tried first, then whole-word keywords. The first
 * hit in table order wins. No hit means no candidate. Dimensions are parsed separately by
 * {@link DimensionParser}.
 */
public class TextAttributeExtractor implements AttributeExtractor {

    static final double PHRASE_CONFIDENCE = 0.90;
    static final double KEYWORD_CONFIDENCE = 0.75;

    private static final List<AttributeRules> RULES = List.of(
            new AttributeRules(AttributeNames.CATEGORY,
                    table("sectional sofa", "Sectional",
                            "dining table", "Table",
                            "coffee table", "Coffee Table",
                            "accent chair", "Chair",
                            "bar stool", "Stool"),
                    table("sofa", "Sofa",
                            "couch", "Sofa",
                            "sectional", "Sectional",
                            "loveseat", "Sofa",
                            "chair", "Chair",
                            "stool", "Stool",
                            "bench", "Bench",
                            "table", "Table",
                            "desk", "Desk",
                            "lamp", "Lighting",
                            "bed", "Bed",
                            "dresser", "Dresser")),
            new AttributeRules(AttributeNames.ROOM_TYPE,
                    table("living room", "Living Room",
                            "dining room", "Dining Room",
                            "home office", "Home Office",
                            "entryway", "Entryway",
                            "kids room", "Kids Room"),
                    table("bedroom", "Bedroom",
                            "dining", "Dining Room",
                            "office", "Home Office",
                            "outdoor", "Outdoor",
                            "patio", "Outdoor",
                            "hallway", "Entryway",
                            "nursery", "Kids Room")),
            new AttributeRules(AttributeNames.STYLE,
                    table("mid-century modern", "Mid-Century",
                            "mid-century", "Mid-Century",
                            "art deco", "Art Deco",
                            "farmhouse chic", "Farmhouse"),
                    table("mid-century", "Mid-Century",
                            "midcentury", "Mid-Century",
                            "modern", "Modern",
                            "rustic", "Rustic",
                            "industrial", "Industrial",
                            "boho", "Bohemian",
                            "bohemian", "Bohemian",
                            "scandi", "Scandinavian",
                            "scandinavian", "Scandinavian",
                            "farmhouse", "Farmhouse",
                            "traditional", "Traditional",
                            "minimalist", "Minimalist",
                            "coastal", "Coastal")),
            new AttributeRules(AttributeNames.MATERIAL,
                    table("solid wood", "Wood",
                            "top-grain leather", "Leather"),
                    table("walnut", "Walnut",
                            "oak", "Oak",
                            "pine", "Pine",
                            "leather", "Leather",
                            "linen", "Linen",
                            "velvet", "Velvet",
                            "boucle", "Boucle",
                            "metal", "Metal",
                            "steel", "Metal",
                            "iron", "Metal",
                            "aluminum", "Metal",
                            "glass", "Glass",
                            "rattan", "Rattan",
                            "bamboo", "Bamboo",
                            "marble", "Marble",
                            "stone", "Stone"))
    );

    private final DimensionParser dimensionParser;

    public TextAttributeExtractor(DimensionParser dimensionParser) {
        this.dimensionParser = dimensionParser;
    }

    @Override
    public AttributeSource source() {
        return AttributeSource.TEXT;
    }

    @Override
    public List<AttributeCandidate> extract(IngestedRecord ingested, Deadline deadline) {
        ProductRecord record = ingested.record();
        if (record.title().indexOf('\0') >= 0 || record.description().indexOf('\0') >= 0) {
            throw new ExtractionException(StageErrorType.MALFORMED_INPUT,
                    "Record text contains NUL characters");
        }

        List<String> sources = new ArrayList<>(2);
        if (!record.title().isEmpty()) {
            sources.add(record.title());
        }
        if (!record.description().isEmpty()) {
            sources.add(record.description());
        }
        if (sources.isEmpty()) {
            return List.of();
        }
        String combined = String.join(" \n ", sources).toLowerCase(Locale.ROOT);

        List<AttributeCandidate> candidates = new ArrayList<>();
        for (AttributeRules rules : RULES) {
            rules.match(combined, sources).ifPresent(candidates::add);
        }
        dimensionParser.parse(record.title(), record.description())
                .map(dims -> AttributeCandidate.text(AttributeNames.DIMENSIONS,
                        dims.display(), dims.confidence(), List.of(dims.evidence())))
                .ifPresent(candidates::add);
        return candidates;
    }

    private static Map<String, String> table(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private record AttributeRules(String attributeName,
                                  Map<String, String> phrases,
                                  Map<String, Pattern> keywordPatterns,
                                  Map<String, String> keywords) {

        AttributeRules(String attributeName, Map<String, String> phrases, Map<String, String> keywords) {
            this(attributeName, phrases, compile(keywords), keywords);
        }

        Optional<AttributeCandidate> match(String combined, List<String> sources) {
            for (Map.Entry<String, String> phrase : phrases.entrySet()) {
                if (combined.contains(phrase.getKey())) {
                    return Optional.of(candidate(phrase.getValue(), PHRASE_CONFIDENCE,
                            Snippets.around(sources, phrase.getKey())));
                }
            }
            for (Map.Entry<String, Pattern> keyword : keywordPatterns.entrySet()) {
                if (keyword.getValue().matcher(combined).find()) {
                    return Optional.of(candidate(keywords.get(keyword.getKey()), KEYWORD_CONFIDENCE,
                            Snippets.around(sources, keyword.getKey())));
                }
            }
            return Optional.empty();
        }

        private AttributeCandidate candidate(String value, double confidence, String evidence) {
            return AttributeCandidate.text(attributeName, value, confidence, List.of(evidence));
        }

        private static Map<String, Pattern> compile(Map<String, String> keywords) {
            Map<String, Pattern> patterns = new LinkedHashMap<>();
            keywords.keySet().forEach(k -> patterns.put(k, Pattern.compile("\\b" + Pattern.quote(k) + "\\b")));
            return patterns;
        }
    }
}
