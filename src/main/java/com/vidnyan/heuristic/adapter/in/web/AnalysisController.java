package com.vidnyan.heuristic.adapter.in.web;

import com.vidnyan.heuristic.AnalysisProperties;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.PageAnalysis;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for scoring pages from extracted features.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalyzePageUseCase analyzePageUseCase;
    private final AnalysisProperties properties;

    @PostMapping("/analyze")
    public AnalysisResponse analyze(@Valid @RequestBody AnalyzePageRequest request) {
        log.info("Received analysis request for {}", request.url());

        PageAnalysis analysis = analyzePageUseCase.analyze(
                request.toAnalysisRequest(properties.getDefaultDeviceType()));

        return AnalysisResponse.from(analysis);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "message", "Heuristic scoring engine is running");
    }
}
