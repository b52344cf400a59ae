package com.vidnyan.heuristic.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.heuristic.domain.recommendation.RecommendationRanker;
import com.vidnyan.heuristic.domain.rule.CategoryEvaluator;
import com.vidnyan.heuristic.domain.rule.RuleCatalog;
import com.vidnyan.heuristic.domain.score.ScoreAggregator;
import com.vidnyan.heuristic.domain.summary.SummaryClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the scoring engine.
 * Wires the framework-free domain components.
 */
@Slf4j
@Configuration
public class HeuristicConfiguration {

    /**
     * ObjectMapper for JSON parsing and report output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public RecommendationRanker recommendationRanker() {
        return new RecommendationRanker();
    }

    @Bean
    public ScoreAggregator scoreAggregator(RecommendationRanker recommendationRanker) {
        return new ScoreAggregator(recommendationRanker);
    }

    @Bean
    public SummaryClassifier summaryClassifier() {
        return new SummaryClassifier();
    }

    /**
     * Log available evaluators on startup.
     */
    @Bean
    public String logEvaluators(List<CategoryEvaluator> evaluators) {
        log.info("Registered {} category evaluators over {} rules:", evaluators.size(), RuleCatalog.all().size());
        evaluators.forEach(e -> log.info("  - {} ({}, max {})", e.getName(), e.category().key(),
                e.category().maxScore()));
        return "evaluators-logged";
    }
}
