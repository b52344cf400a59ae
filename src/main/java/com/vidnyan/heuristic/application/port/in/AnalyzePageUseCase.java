package com.vidnyan.heuristic.application.port.in;

import com.vidnyan.heuristic.domain.feature.FeatureMap;
import com.vidnyan.heuristic.domain.score.AnalysisScoreReport;
import com.vidnyan.heuristic.domain.summary.SummaryView;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Primary use case: score a captured page.
 * This is the main entry point to the application.
 */
public interface AnalyzePageUseCase {

    /**
     * Analyze one page from its extracted features.
     * @param request page identity and raw extractor output
     * @return report, summary and request metadata
     * @throws AnalysisFailedException if no features were captured at all
     */
    PageAnalysis analyze(AnalysisRequest request);

    /**
     * Score a feature map. Pure: the same features always give the same report.
     */
    AnalysisScoreReport score(FeatureMap features);

    /**
     * Derive the summary view of a report.
     */
    SummaryView summarize(AnalysisScoreReport report);

    /**
     * Analysis request parameters.
     * A null feature namespace means its extractor produced nothing.
     */
    record AnalysisRequest(
        String url,
        DeviceType deviceType,
        Map<String, Object> htmlFeatures,
        Map<String, Object> imageFeatures
    ) {}

    /**
     * Analysis result.
     */
    record PageAnalysis(
        String analysisId,
        String url,
        DeviceType deviceType,
        Instant timestamp,
        AnalysisScoreReport report,
        SummaryView summary,
        Duration analysisTime
    ) {}
}
