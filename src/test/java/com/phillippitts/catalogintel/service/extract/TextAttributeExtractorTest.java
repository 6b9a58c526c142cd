package com.phillippitts.catalogintel.service.extract;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.ExtractionException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.util.Deadline;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextAttributeExtractorTest {

    private final TextAttributeExtractor extractor = new TextAttributeExtractor(new DimensionParser());

    private Map<String, AttributeCandidate> extract(String title, String description) {
        IngestedRecord record = IngestedRecord.withoutImage(ProductRecord.of("p1", title, description));
        return extractor.extract(record, Deadline.none()).stream()
                .collect(Collectors.toMap(AttributeCandidate::attributeName, Function.identity()));
    }

    @Test
    void phrasesWinOverKeywords() {
        Map<String, AttributeCandidate> found = extract("Oak dining table", "Seats six in the dining room");

        assertThat(found.get("category").value()).isEqualTo("Table");
        assertThat(found.get("category").confidence()).isEqualTo(TextAttributeExtractor.PHRASE_CONFIDENCE);
        assertThat(found.get("room_type").value()).isEqualTo("Dining Room");
        assertThat(found.get("material").value()).isEqualTo("Oak");
        assertThat(found.get("material").confidence()).isEqualTo(TextAttributeExtractor.KEYWORD_CONFIDENCE);
        assertThat(found).doesNotContainKey("style");
    }

    @Test
    void everyCandidateIsTextSourced() {
        IngestedRecord record = IngestedRecord.withoutImage(
                ProductRecord.of("p1", "Modern velvet sofa", "Perfect for the living room"));

        List<AttributeCandidate> candidates = extractor.extract(record, Deadline.none());

        assertThat(candidates).isNotEmpty();
        assertThat(candidates).allSatisfy(c -> assertThat(c.source()).isEqualTo(AttributeSource.TEXT));
        assertThat(extractor.source()).isEqualTo(AttributeSource.TEXT);
    }

    @Test
    void keywordsRequireWholeWords() {
        Map<String, AttributeCandidate> found = extract("Tablet stand", "");

        assertThat(found).doesNotContainKey("category");
    }

    @Test
    void evidenceIsSnippetOfOriginalText() {
        Map<String, AttributeCandidate> found = extract("Rustic Farmhouse Bench", "");

        assertThat(found.get("category").evidence()).containsExactly("Rustic Farmhouse Bench");
        assertThat(found.get("style").value()).isEqualTo("Rustic");
    }

    @Test
    void emptyTextYieldsNothing() {
        assertThat(extract("", "")).isEmpty();
    }

    @Test
    void nulCharactersAreMalformedInput() {
        IngestedRecord record = IngestedRecord.withoutImage(ProductRecord.of("p1", "Sofa\0", ""));

        assertThatThrownBy(() -> extractor.extract(record, Deadline.none()))
                .isInstanceOfSatisfying(ExtractionException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(StageErrorType.MALFORMED_INPUT));
    }

    @Test
    void emitsDimensionsCandidate() {
        Map<String, AttributeCandidate> found = extract("Sofa", "Measures 60 x 30 x 18 in overall");

        AttributeCandidate dims = found.get("dimensions");
        assertThat(dims.value()).isEqualTo("60 x 30 x 18 in");
        assertThat(dims.confidence()).isEqualTo(0.95);
    }
}
