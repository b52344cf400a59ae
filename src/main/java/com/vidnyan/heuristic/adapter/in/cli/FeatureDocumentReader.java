package com.vidnyan.heuristic.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.heuristic.adapter.in.web.AnalyzePageRequest;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.AnalysisRequest;
import com.vidnyan.heuristic.application.port.in.DeviceType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads a feature document (same JSON shape as the REST request body) from disk
 * and checks it against the same constraints as a REST request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureDocumentReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * @throws IOException if the file is missing or not a valid feature document
     */
    public AnalysisRequest read(Path file, DeviceType defaultDeviceType) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Feature document not found: " + file);
        }
        AnalyzePageRequest document = objectMapper.readValue(file.toFile(), AnalyzePageRequest.class);

        Set<ConstraintViolation<AnalyzePageRequest>> violations = validator.validate(document);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IOException("Invalid feature document " + file + ": " + details);
        }

        log.debug("Read feature document for {} from {}", document.url(), file);
        return document.toAnalysisRequest(defaultDeviceType);
    }
}
