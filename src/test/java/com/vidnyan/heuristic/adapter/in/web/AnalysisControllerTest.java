package com.vidnyan.heuristic.adapter.in.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void analyze_ShouldScoreTheSampleDocument() throws Exception {
        String body = new ClassPathResource("sample-features.json").getContentAsString(StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.url").value("https://shop.example.com/checkout"))
                .andExpect(jsonPath("$.device_type").value("mobile"))
                .andExpect(jsonPath("$.analysis_id").isNotEmpty())
                .andExpect(jsonPath("$.timestamp").isNotEmpty())
                .andExpect(jsonPath("$.total_score").value(92))
                .andExpect(jsonPath("$.categories.information_architecture").value(28))
                .andExpect(jsonPath("$.categories.form_ux").value(9))
                .andExpect(jsonPath("$.recommendations", hasSize(3)))
                .andExpect(jsonPath("$.recommendations[0]").value("Give every input field a proper label"))
                .andExpect(jsonPath("$.recommendations[1]")
                        .value("Add breadcrumb navigation so users can see where they are"))
                .andExpect(jsonPath("$.recommendations[2]").value("Improve the contrast ratio across the whole page"))
                .andExpect(jsonPath("$.category_details.form_ux.max_score").value(15))
                .andExpect(jsonPath("$.category_details.form_ux.rules[0].description")
                        .value("2 input fields have no label"))
                .andExpect(jsonPath("$.summary.score_level").value("excellent"))
                .andExpect(jsonPath("$.summary.strengths[0].category").value("cta_visibility"))
                .andExpect(jsonPath("$.summary.weaknesses", hasSize(0)))
                .andExpect(jsonPath("$.analysis_time").isNumber());
    }

    @Test
    void analyze_ShouldDefaultTheDeviceType() throws Exception {
        String body = """
                {"url": "https://example.com", "features": {"html": {}}}
                """;

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.device_type").value("desktop"));
    }

    @Test
    void invalidUrl_ShouldBeRejected() throws Exception {
        String body = """
                {"url": "not a url", "features": {"html": {}, "image": {}}}
                """;

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.error").value("validation_failed"))
                .andExpect(jsonPath("$.details", hasItem("url: url must be an absolute http(s) URL")));
    }

    @Test
    void unknownDeviceType_ShouldBeRejected() throws Exception {
        String body = """
                {"url": "https://example.com", "device_type": "watch", "features": {"html": {}}}
                """;

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"));
    }

    @Test
    void missingFeatures_ShouldFailTheAnalysis() throws Exception {
        String body = """
                {"url": "https://example.com", "device_type": "desktop"}
                """;

        mockMvc.perform(post("/api/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("analysis_failed"));
    }

    @Test
    void health_ShouldReportOk() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
