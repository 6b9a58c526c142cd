package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.service.fusion.ConfidenceFusionEngine;

import java.util.List;

final class SinkTestFixtures {

    private SinkTestFixtures() {
    }

    static PredictionRecord prediction(String productId) {
        return new ConfidenceFusionEngine().fuse(productId, "Walnut, \"modern\" desk", List.of(
                AttributeCandidate.text("category", "Desk", 0.9, List.of("walnut desk")),
                AttributeCandidate.vision("category", "Table", 0.6, List.of("vision label: Table (table)")),
                AttributeCandidate.text("material", "Walnut", 0.75, List.of("Walnut"))));
    }
}
