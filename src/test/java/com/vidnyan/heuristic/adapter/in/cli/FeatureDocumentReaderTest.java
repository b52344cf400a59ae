package com.vidnyan.heuristic.adapter.in.cli;

import com.vidnyan.heuristic.FeatureFixtures;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.AnalysisRequest;
import com.vidnyan.heuristic.application.port.in.DeviceType;
import com.vidnyan.heuristic.config.HeuristicConfiguration;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FeatureDocumentReaderTest {

    private final FeatureDocumentReader reader = new FeatureDocumentReader(
            new HeuristicConfiguration().objectMapper(),
            Validation.buildDefaultValidatorFactory().getValidator());

    @TempDir
    Path tempDir;

    @Test
    void read_ShouldParseTheSampleDocument() throws Exception {
        Path file = new ClassPathResource("sample-features.json").getFile().toPath();

        AnalysisRequest request = reader.read(file, DeviceType.DESKTOP);

        assertEquals("https://shop.example.com/checkout", request.url());
        assertEquals(DeviceType.MOBILE, request.deviceType());
        assertNotNull(request.htmlFeatures());
        assertNotNull(request.imageFeatures());
        assertEquals(92, FeatureFixtures.scoringService().analyze(request).report().totalScore());
    }

    @Test
    void read_ShouldApplyTheDefaultDeviceTypeAndKeepMissingNamespacesAbsent() throws Exception {
        Path file = tempDir.resolve("page.json");
        Files.writeString(file, """
                {"url": "https://example.com", "features": {"html": {"heading_analysis": {"has_h1": true}}},
                 "captured_by": "extractor 2.1"}
                """);

        AnalysisRequest request = reader.read(file, DeviceType.TABLET);

        assertEquals(DeviceType.TABLET, request.deviceType());
        assertNotNull(request.htmlFeatures());
        assertNull(request.imageFeatures());
    }

    @Test
    void missingFile_ShouldFail() {
        assertThrows(IOException.class, () -> reader.read(tempDir.resolve("absent.json"), DeviceType.DESKTOP));
    }

    @Test
    void documentWithoutUrl_ShouldFail() throws Exception {
        Path file = tempDir.resolve("no-url.json");
        Files.writeString(file, "{\"features\": {\"html\": {}}}");

        assertThrows(IOException.class, () -> reader.read(file, DeviceType.DESKTOP));
    }

    @Test
    void documentWithInvalidUrl_ShouldFailLikeTheRestApi() throws Exception {
        Path file = tempDir.resolve("bad-url.json");
        Files.writeString(file, "{\"url\": \"ftp://example.com\", \"features\": {\"html\": {}}}");

        IOException ex = assertThrows(IOException.class, () -> reader.read(file, DeviceType.DESKTOP));
        assertTrue(ex.getMessage().contains("url: url must be an absolute http(s) URL"), ex.getMessage());
    }

    @Test
    void malformedJson_ShouldFail() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"url\": ");

        assertThrows(IOException.class, () -> reader.read(file, DeviceType.DESKTOP));
    }
}
