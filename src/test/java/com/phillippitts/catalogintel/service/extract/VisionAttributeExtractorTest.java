package com.phillippitts.catalogintel.service.extract;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.AttributeSource;
import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.exception.ExtractionException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.util.Deadline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VisionAttributeExtractorTest {

    @TempDir
    Path tempDir;

    private IngestedRecord withImage() throws IOException {
        Path image = Files.write(tempDir.resolve("sofa.jpg"), new byte[] {1, 2, 3});
        return new IngestedRecord(ProductRecord.of("p1", "Sofa", ""), image);
    }

    private static VisionLabelProvider fixed(String label, double confidence, boolean blurry, boolean dark) {
        return image -> new VisionPrediction(List.of(new VisionLabel(label, confidence)),
                blurry, false, dark, "trace");
    }

    @Test
    void topLabelMapsToCategoryAndRoom() throws IOException {
        var extractor = new VisionAttributeExtractor(fixed("sofa", 0.8, false, false), 0.15);

        List<AttributeCandidate> candidates = extractor.extract(withImage(), Deadline.none());

        assertThat(candidates).extracting(AttributeCandidate::attributeName).containsExactly("category", "room_type");
        assertThat(candidates).allSatisfy(c -> {
            assertThat(c.source()).isEqualTo(AttributeSource.VISION);
            assertThat(c.confidence()).isEqualTo(0.8);
        });
        assertThat(candidates.get(0).value()).isEqualTo("Sofa");
        assertThat(candidates.get(0).evidence()).containsExactly("vision label: Sofa (sofa)");
        assertThat(candidates.get(1).value()).isEqualTo("Living Room");
    }

    @Test
    void qualityIssuesApplyPenaltyAndNoteIt() throws IOException {
        var extractor = new VisionAttributeExtractor(fixed("bed", 0.8, true, true), 0.15);

        List<AttributeCandidate> candidates = extractor.extract(withImage(), Deadline.none());

        AttributeCandidate category = candidates.get(0);
        assertThat(category.confidence()).isCloseTo(0.65, within(1e-9));
        assertThat(category.evidence()).containsExactly(
                "vision label: Bed (bed)",
                "vision confidence adjusted for blurry, dark (-0.15)");
    }

    @Test
    void penaltyIsFlooredAtZero() throws IOException {
        var extractor = new VisionAttributeExtractor(fixed("desk", 0.1, true, false), 0.5);

        List<AttributeCandidate> candidates = extractor.extract(withImage(), Deadline.none());

        assertThat(candidates).allSatisfy(c -> assertThat(c.confidence()).isZero());
    }

    @Test
    void labelWithoutRoomMappingOnlyYieldsCategory() throws IOException {
        var extractor = new VisionAttributeExtractor(fixed("chair", 0.7, false, false), 0.15);

        List<AttributeCandidate> candidates = extractor.extract(withImage(), Deadline.none());

        assertThat(candidates).extracting(AttributeCandidate::attributeName).containsExactly("category");
    }

    @Test
    void unknownLabelYieldsNothing() throws IOException {
        var extractor = new VisionAttributeExtractor(fixed("spaceship", 0.9, false, false), 0.15);

        assertThat(extractor.extract(withImage(), Deadline.none())).isEmpty();
    }

    @Test
    void recordWithoutImageYieldsNothing() {
        var extractor = new VisionAttributeExtractor(new HashingVisionLabelProvider(), 0.15);

        List<AttributeCandidate> candidates = extractor.extract(
                IngestedRecord.withoutImage(ProductRecord.of("p1", "Sofa", "")), Deadline.none());

        assertThat(candidates).isEmpty();
    }

    @Test
    void missingImageIsUnreachable() {
        var extractor = new VisionAttributeExtractor(new HashingVisionLabelProvider(), 0.15);
        var record = new IngestedRecord(ProductRecord.of("p1", "Sofa", ""), tempDir.resolve("gone.jpg"));

        assertThatThrownBy(() -> extractor.extract(record, Deadline.none()))
                .isInstanceOfSatisfying(ExtractionException.class, e ->
                        assertThat(e.getErrorType()).isEqualTo(StageErrorType.UNREACHABLE_RESOURCE));
    }

    @Test
    void rejectsPenaltyOutOfRange() {
        assertThatThrownBy(() -> new VisionAttributeExtractor(new HashingVisionLabelProvider(), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
