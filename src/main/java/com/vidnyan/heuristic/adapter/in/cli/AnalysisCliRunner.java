package com.vidnyan.heuristic.adapter.in.cli;

import com.vidnyan.heuristic.AnalysisProperties;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.AnalysisRequest;
import com.vidnyan.heuristic.application.port.in.AnalyzePageUseCase.PageAnalysis;
import com.vidnyan.heuristic.domain.rule.RuleViolation;
import com.vidnyan.heuristic.domain.rule.Severity;
import com.vidnyan.heuristic.domain.score.AnalysisScoreReport;
import com.vidnyan.heuristic.domain.score.CategoryResult;
import com.vidnyan.heuristic.domain.summary.CategoryStanding;
import com.vidnyan.heuristic.domain.summary.SummaryView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * CLI Runner for scoring a single feature document.
 * Runs when heuristic.analysis.features-path is set, then stops the JVM with
 * exit code 0 on success and 1 on failure.
 */
@Slf4j
@Component
public class AnalysisCliRunner implements CommandLineRunner {

    private final AnalyzePageUseCase analyzePageUseCase;
    private final FeatureDocumentReader featureDocumentReader;
    private final AnalysisProperties properties;
    private final ConfigurableApplicationContext context;
    private final IntConsumer processExit;

    @Autowired
    public AnalysisCliRunner(AnalyzePageUseCase analyzePageUseCase,
                             FeatureDocumentReader featureDocumentReader,
                             AnalysisProperties properties,
                             ConfigurableApplicationContext context) {
        this(analyzePageUseCase, featureDocumentReader, properties, context, System::exit);
    }

    AnalysisCliRunner(AnalyzePageUseCase analyzePageUseCase,
                      FeatureDocumentReader featureDocumentReader,
                      AnalysisProperties properties,
                      ConfigurableApplicationContext context,
                      IntConsumer processExit) {
        this.analyzePageUseCase = analyzePageUseCase;
        this.featureDocumentReader = featureDocumentReader;
        this.properties = properties;
        this.context = context;
        this.processExit = processExit;
    }

    @Override
    public void run(String... args) throws Exception {
        String featuresPath = properties.getFeaturesPath();
        if (featuresPath == null || featuresPath.isBlank()) {
            log.info("No feature document specified. Set heuristic.analysis.features-path to score one.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           Heuristic Page Scoring                             ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Features: {}", truncatePath(featuresPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AnalysisRequest request = featureDocumentReader.read(Path.of(featuresPath),
                    properties.getDefaultDeviceType());
            PageAnalysis analysis = analyzePageUseCase.analyze(request);

            printReport(analysis);
            printSummary(analysis.summary());

            log.info("");
            log.info("Analysis complete!");
        } catch (Exception e) {
            log.error("Could not score {}: {}", featuresPath, e.getMessage(), e);
            exitCode = 1;
        } finally {
            int code = exitCode;
            processExit.accept(SpringApplication.exit(context, () -> code));
        }
    }

    private void printReport(PageAnalysis analysis) {
        AnalysisScoreReport report = analysis.report();

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" SCORE: {}/100  ({})", report.totalScore(), analysis.url());
        log.info("═══════════════════════════════════════════════════════════════");
        for (CategoryResult result : report.categoryResults()) {
            log.info(" {} {}/{}", String.format("%-26s", result.category().key()),
                    result.score(), result.maxScore());
        }
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" VIOLATIONS: high {}, medium {}, low {}",
                report.violationCount(Severity.HIGH),
                report.violationCount(Severity.MEDIUM),
                report.violationCount(Severity.LOW));

        for (RuleViolation v : report.violations()) {
            log.info("   [{}] {} ({}, {})", v.severity().label(), v.description(), v.ruleId(), v.scoreImpact());
        }

        log.info("");
        log.info(" RECOMMENDATIONS:");
        int rank = 0;
        for (String recommendation : report.recommendations()) {
            log.info("  {}. {}", ++rank, recommendation);
        }
    }

    private void printSummary(SummaryView summary) {
        log.info("");
        log.info(" TIER:       {} ({})", summary.tier().level(), summary.scoreMessage());
        log.info(" STRENGTHS:  {}", summary.strengths().stream()
                .map(this::formatStanding)
                .collect(Collectors.joining(", ")));
        log.info(" WEAKNESSES: {}", summary.weaknesses().stream()
                .map(this::formatStanding)
                .collect(Collectors.joining(", ")));
    }

    private String formatStanding(CategoryStanding standing) {
        return String.format("%s %.0f%%", standing.category().key(), standing.percentage());
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
