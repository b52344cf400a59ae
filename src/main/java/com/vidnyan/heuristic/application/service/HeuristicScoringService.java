package com.vidnyan.heuristic.application.service;

import com.vidnyan.heuristic.application.port.in.AnalysisFailedException;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase;
import com.vidnyan.heuristic.domain.feature.FeatureMap;
import com.vidnyan.heuristic.domain.feature.FeatureNamespace;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.rule.CategoryEvaluator;
import com.vidnyan.heuristic.domain.score.AnalysisScoreReport;
import com.vidnyan.heuristic.domain.score.CategoryResult;
import com.vidnyan.heuristic.domain.score.ScoreAggregator;
import com.vidnyan.heuristic.domain.summary.SummaryClassifier;
import com.vidnyan.heuristic.domain.summary.SummaryView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Main application service that orchestrates page scoring.
 * Implements the primary use case.
 *
 * <p>Holds no per-request state; safe to call from any number of threads.
 */
@Slf4j
@Service
public class HeuristicScoringService implements AnalyzePageUseCase {

    private final Map<Category, CategoryEvaluator> evaluators;
    private final ScoreAggregator scoreAggregator;
    private final SummaryClassifier summaryClassifier;

    public HeuristicScoringService(List<CategoryEvaluator> evaluators,
                                   ScoreAggregator scoreAggregator,
                                   SummaryClassifier summaryClassifier) {
        this.evaluators = indexByCategory(evaluators);
        this.scoreAggregator = scoreAggregator;
        this.summaryClassifier = summaryClassifier;
    }

    @Override
    public PageAnalysis analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        String analysisId = UUID.randomUUID().toString();
        log.info("Starting analysis {} of: {} (device: {})", analysisId, request.url(), request.deviceType().key());

        if (request.htmlFeatures() == null && request.imageFeatures() == null) {
            log.error("Analysis {} failed: no features captured for {}", analysisId, request.url());
            throw new AnalysisFailedException("No page features were captured for " + request.url());
        }

        FeatureMap features = FeatureMap.of(request.htmlFeatures(), request.imageFeatures());
        for (FeatureNamespace namespace : FeatureNamespace.values()) {
            if (!features.hasNamespace(namespace)) {
                log.warn("No {} features for {}; scoring with default values", namespace.key(), request.url());
            }
        }

        AnalysisScoreReport report = score(features);
        SummaryView summary = summarize(report);

        Duration analysisTime = Duration.between(startTime, Instant.now());
        log.info("Analysis {} complete: {} scored {}/100 ({}) in {}ms", analysisId, request.url(),
                report.totalScore(), summary.tier().level(), analysisTime.toMillis());

        return new PageAnalysis(analysisId, request.url(), request.deviceType(), startTime,
                report, summary, analysisTime);
    }

    @Override
    public AnalysisScoreReport score(FeatureMap features) {
        List<CategoryResult> results = evaluators.values().stream()
                .map(evaluator -> evaluator.evaluate(features))
                .toList();
        return scoreAggregator.aggregate(results);
    }

    @Override
    public SummaryView summarize(AnalysisScoreReport report) {
        return summaryClassifier.classify(report);
    }

    private static Map<Category, CategoryEvaluator> indexByCategory(List<CategoryEvaluator> evaluators) {
        Map<Category, CategoryEvaluator> index = new EnumMap<>(Category.class);
        for (CategoryEvaluator evaluator : evaluators) {
            CategoryEvaluator previous = index.put(evaluator.category(), evaluator);
            if (previous != null) {
                throw new IllegalStateException(String.format("Both %s and %s evaluate %s",
                        previous.getName(), evaluator.getName(), evaluator.category().key()));
            }
        }
        for (Category category : Category.values()) {
            if (!index.containsKey(category)) {
                throw new IllegalStateException("No evaluator registered for " + category.key());
            }
        }
        return index;
    }
}
