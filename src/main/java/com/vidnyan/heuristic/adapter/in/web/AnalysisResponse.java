package com.vidnyan.heuristic.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.PageAnalysis;
import com.vidnyan.heuristic.application.port.in.DeviceType;
import com.vidnyan.heuristic.domain.score.AnalysisScoreReport;
import com.vidnyan.heuristic.domain.score.CategoryResult;
import com.vidnyan.heuristic.domain.summary.SummaryView;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body of {@code POST /api/analyze}.
 */
@JsonPropertyOrder({"analysis_id", "url", "device_type", "timestamp", "total_score", "categories",
        "recommendations", "category_details", "summary", "analysis_time"})
public record AnalysisResponse(
    @JsonProperty("analysis_id") String analysisId,
    @JsonProperty("url") String url,
    @JsonProperty("device_type") DeviceType deviceType,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("total_score") int totalScore,
    @JsonProperty("categories") Map<String, Integer> categories,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("category_details") Map<String, CategoryResult> categoryDetails,
    @JsonProperty("summary") SummaryView summary,
    @JsonProperty("analysis_time") double analysisTime
) {

    public static AnalysisResponse from(PageAnalysis analysis) {
        AnalysisScoreReport report = analysis.report();
        return new AnalysisResponse(
                analysis.analysisId(),
                analysis.url(),
                analysis.deviceType(),
                analysis.timestamp(),
                report.totalScore(),
                report.categoryScores(),
                report.recommendations(),
                report.categoryDetails(),
                analysis.summary(),
                analysis.analysisTime().toNanos() / 1_000_000_000.0
        );
    }
}
