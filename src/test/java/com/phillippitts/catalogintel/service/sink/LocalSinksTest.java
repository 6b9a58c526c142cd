package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.util.Digests;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LocalSinksTest {

    @TempDir
    Path tempDir;

    @Test
    void publisherAppendsJsonLinesAndReturnsDigest() throws IOException {
        var publisher = new LocalFilePublisher(tempDir.resolve("events"));
        JSONObject first = new JSONObject().put("n", 1);
        JSONObject second = new JSONObject().put("n", 2);

        String id = publisher.publish("catalog_predictions", first);
        publisher.publish("catalog_predictions", second);

        List<String> lines = Files.readAllLines(tempDir.resolve("events/catalog_predictions.jsonl"));
        assertThat(lines).containsExactly("{\"n\":1}", "{\"n\":2}");
        assertThat(id).isEqualTo(Digests.sha1Hex("{\"n\":1}"));
    }

    @Test
    void flattenerProducesFixedColumns() {
        Map<String, Object> row = new PredictionRowFlattener().flatten(
                SinkTestFixtures.prediction("sku-1"), "evt", Instant.parse("2024-01-01T00:00:00Z"));

        assertThat(row.keySet()).containsExactly(
                "event_id", "event_ts", "product_id",
                "category_value", "category_confidence",
                "room_type_value", "room_type_confidence",
                "style_value", "style_confidence",
                "material_value", "material_confidence",
                "raw_payload");
        assertThat(row.get("category_value")).isEqualTo("Desk");
        assertThat(row.get("room_type_value")).isNull();
        assertThat(new JSONObject((String) row.get("raw_payload")).getString("product_id")).isEqualTo("sku-1");
    }

    @Test
    void warehouseWritesHeaderOnceAndEscapesValues() throws IOException {
        var sink = new LocalCsvWarehouseSink(tempDir.resolve("warehouse"));
        var flattener = new PredictionRowFlattener();
        Instant ts = Instant.parse("2024-01-01T00:00:00Z");

        sink.writeRows("catalog", "predictions", List.of(flattener.flatten(SinkTestFixtures.prediction("a"), "e1", ts)));
        sink.writeRows("catalog", "predictions", List.of(flattener.flatten(SinkTestFixtures.prediction("b"), "e2", ts)));

        String csv = Files.readString(tempDir.resolve("warehouse/catalog.predictions.csv"), StandardCharsets.UTF_8);
        assertThat(csv.split("\r\n", -1)[0]).startsWith("event_id,event_ts,product_id,category_value");
        assertThat(csv.split("event_id,event_ts", -1)).hasSize(2);
        assertThat(csv).contains("e1,2024-01-01T00:00:00Z,a,Desk");
        assertThat(csv).contains("e2,2024-01-01T00:00:00Z,b,Desk");
    }

    @Test
    void escapesCsvSpecialCharacters() {
        assertThat(LocalCsvWarehouseSink.escape("plain")).isEqualTo("plain");
        assertThat(LocalCsvWarehouseSink.escape("a,b")).isEqualTo("\"a,b\"");
        assertThat(LocalCsvWarehouseSink.escape("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(LocalCsvWarehouseSink.escape(null)).isEmpty();
    }
}
