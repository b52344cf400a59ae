package com.vidnyan.heuristic.domain.summary;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Human-oriented digest of a report. Derived on demand, never stored.
 */
@JsonPropertyOrder({"overall_score", "score_level", "score_message", "strengths", "weaknesses", "top_recommendations"})
public record SummaryView(
    @JsonProperty("overall_score") int overallScore,
    @JsonProperty("score_level") ScoreTier tier,
    @JsonProperty("strengths") List<CategoryStanding> strengths,
    @JsonProperty("weaknesses") List<CategoryStanding> weaknesses,
    @JsonProperty("top_recommendations") List<String> topRecommendations
) {

    public SummaryView {
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        topRecommendations = List.copyOf(topRecommendations);
    }

    @JsonProperty("score_message")
    public String scoreMessage() {
        return tier.message();
    }
}
