package com.phillippitts.catalogintel;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
    properties = {
        "catalog.guardrails.max-batch-items=3",
        "catalog.guardrails.rate-limit-capacity=0",
        "catalog.pipeline.image-cache-dir=target/test-cache/images",
        "catalog.sinks.publish-enabled=false",
        "catalog.sinks.warehouse-enabled=false"
    }
)
@AutoConfigureMockMvc
class CatalogIntelApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void healthEndpointReportsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void predictsSingleRecordWithoutImage() throws Exception {
        mockMvc.perform(post("/v1/predict")
                        .header("X-Request-ID", "it-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"sku-1\",\"title\":\"Walnut modern desk\",\"description\":\"Solid wood\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "it-1"))
                .andExpect(jsonPath("$.product_id").value("sku-1"))
                .andExpect(jsonPath("$.final_predictions").isMap())
                .andExpect(jsonPath("$.decision_log").isMap());
    }

    @Test
    void missingProductIdIsValidationError() throws Exception {
        mockMvc.perform(post("/v1/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Desk\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("validation_failed"));
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/v1/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("malformed_request"));
    }

    @Test
    void oversizedBatchIsRejected() throws Exception {
        mockMvc.perform(post("/v1/predict/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":["
                                + "{\"product_id\":\"a\",\"title\":\"x\"},"
                                + "{\"product_id\":\"b\",\"title\":\"x\"},"
                                + "{\"product_id\":\"c\",\"title\":\"x\"},"
                                + "{\"product_id\":\"d\",\"title\":\"x\"}]}"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error_code").value("batch_limit_exceeded"));
    }

    @Test
    void duplicateIdsAreRejected() throws Exception {
        mockMvc.perform(post("/v1/predict/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"product_id\":\"a\",\"title\":\"x\"},{\"product_id\":\"a\",\"title\":\"y\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("duplicate_product_id"));
    }

    @Test
    void batchIsolatesIngestFailure() throws Exception {
        mockMvc.perform(post("/v1/predict/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":["
                                + "{\"product_id\":\"ok\",\"title\":\"Leather sofa\"},"
                                + "{\"product_id\":\"broken\",\"title\":\"Chair\",\"image_url\":\"target/missing/none.png\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].index").value(0))
                .andExpect(jsonPath("$.items[0].product_id").value("ok"))
                .andExpect(jsonPath("$.errors[0].index").value(1))
                .andExpect(jsonPath("$.errors[0].product_id").value("broken"))
                .andExpect(jsonPath("$.errors[0].stage").value("ingest"));
    }
}
