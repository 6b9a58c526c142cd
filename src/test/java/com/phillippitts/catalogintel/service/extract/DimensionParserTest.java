package com.phillippitts.catalogintel.service.extract;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DimensionParserTest {

    private final DimensionParser parser = new DimensionParser();

    @Test
    void parsesThreeAxisPattern() {
        Optional<Dimensions> dims = parser.parse("", "Overall 60 x 30 x 18 in");

        assertThat(dims).isPresent();
        assertThat(dims.get().display()).isEqualTo("60 x 30 x 18 in");
        assertThat(dims.get().confidence()).isEqualTo(0.95);
    }

    @Test
    void parsesLabelledAxes() {
        Optional<Dimensions> dims = parser.parse("Desk W: 20in D: 18in H: 30in", "");

        assertThat(dims).isPresent();
        assertThat(dims.get().width()).isEqualTo(20.0);
        assertThat(dims.get().depth()).isEqualTo(18.0);
        assertThat(dims.get().height()).isEqualTo(30.0);
        assertThat(dims.get().display()).isEqualTo("20 x 18 x 30 in");
    }

    @Test
    void twoAxesScoreLowerConfidence() {
        Optional<Dimensions> dims = parser.parse("", "Rug 160 x 230 cm");

        assertThat(dims).isPresent();
        assertThat(dims.get().display()).isEqualTo("160 x 230 cm");
        assertThat(dims.get().confidence()).isEqualTo(0.85);
    }

    @Test
    void prefersMoreAxes() {
        Optional<Dimensions> dims = parser.parse("Table 80 x 80", "Full size 80 x 80 x 75 cm");

        assertThat(dims.get().axisCount()).isEqualTo(3);
    }

    @Test
    void tiePrefersDescription() {
        Optional<Dimensions> dims = parser.parse("Shelf 10 x 20 cm", "Shelf 30 x 40 cm");

        assertThat(dims.get().display()).isEqualTo("30 x 40 cm");
    }

    @Test
    void stripsTrailingZeros() {
        Dimensions dims = new Dimensions(60.0, 30.5, null, "in", "");

        assertThat(dims.display()).isEqualTo("60 x 30.5 in");
        assertThat(dims.confidence()).isEqualTo(0.85);
    }

    @Test
    void normalizesUnits() {
        assertThat(DimensionParser.normalizeUnit("Inches")).isEqualTo("in");
        assertThat(DimensionParser.normalizeUnit("feet")).isEqualTo("ft");
        assertThat(DimensionParser.normalizeUnit("CM")).isEqualTo("cm");
        assertThat(DimensionParser.normalizeUnit(null)).isNull();
    }

    @Test
    void noDimensionsInPlainText() {
        assertThat(parser.parse("Velvet sofa", "Soft and comfortable")).isEmpty();
    }
}
