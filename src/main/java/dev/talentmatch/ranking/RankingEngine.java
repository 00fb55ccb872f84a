package dev.talentmatch.ranking;

import dev.talentmatch.analysis.AnalysisProperties;
import dev.talentmatch.analysis.AnalysisResult;
import dev.talentmatch.analysis.CandidateAnalyzer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Merges per-candidate assessments and semantic similarity into one weighted score and orders the
 * candidates by it.
 *
 * <p>Analyses run in parallel on the analysis executor, one task per candidate. Each task is bounded
 * by {@code talentmatch.analysis.timeout}, counted from the moment a worker starts it; a timed-out,
 * rejected or failed task yields the fallback assessment (all scores 0) for that candidate only. Results are collected in input order before
 * sorting, so the output never depends on completion order.
 *
 * <p>Sorting is by final score descending and stable: candidates with equal scores keep their input
 * order.
 */
@Service
public class RankingEngine {

  private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

  static final String TIMEOUT_EXPLANATION = "Analysis timed out. Please try again.";
  static final String FAILURE_EXPLANATION = "Analysis could not be completed. Please try again.";

  private final CandidateAnalyzer analyzer;
  private final RankingWeights weights;
  private final Executor executor;
  private final long timeoutMillis;

  public RankingEngine(
      CandidateAnalyzer analyzer,
      RankingWeights weights,
      @Qualifier("analysisExecutor") Executor executor,
      AnalysisProperties analysisProperties) {
    this.analyzer = analyzer;
    this.weights = weights;
    this.executor = executor;
    this.timeoutMillis = analysisProperties.timeout().toMillis();
  }

  /**
   * Scores and orders candidates.
   *
   * @param jobDescription job description text
   * @param candidates candidates in input order
   * @param semanticScores candidate id to similarity in [0, 1]; a missing entry counts as 0
   * @return candidate scores ordered by final score descending, ties in input order
   */
  public List<CandidateScore> rank(
      String jobDescription, List<CandidateInput> candidates, Map<String, Double> semanticScores) {
    List<CompletableFuture<AnalysisResult>> analyses =
        candidates.stream().map(candidate -> analyzeAsync(jobDescription, candidate)).toList();

    List<CandidateScore> scores = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      CandidateInput candidate = candidates.get(i);
      AnalysisResult analysis = analyses.get(i).join();
      double similarity = semanticScores.getOrDefault(candidate.id(), 0.0);
      scores.add(score(candidate, analysis, similarity));
    }

    scores.sort(Comparator.comparingDouble(CandidateScore::finalScore).reversed());
    log.debug("Ranked {} candidates", scores.size());
    return List.copyOf(scores);
  }

  /**
   * Returns the first {@code n} entries of a ranking verbatim.
   *
   * @throws IllegalArgumentException if {@code n} is negative
   */
  public static List<CandidateScore> top(List<CandidateScore> ranked, int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative, got: " + n);
    }
    return List.copyOf(ranked.subList(0, Math.min(n, ranked.size())));
  }

  /** The weights this engine combines scores with. */
  public RankingWeights weights() {
    return weights;
  }

  CandidateScore score(CandidateInput candidate, AnalysisResult analysis, double similarity) {
    double semantic = clamp(similarity * 100.0);
    double combined =
        clamp(
            weights.combine(
                analysis.skillMatchScore(),
                analysis.experienceScore(),
                analysis.toolTechScore(),
                analysis.seniorityScore(),
                semantic));
    String name = analysis.hasUnknownName() ? candidate.displayName() : analysis.candidateName();
    return new CandidateScore(
        name,
        candidate.sourcePath(),
        round(analysis.skillMatchScore()),
        round(analysis.experienceScore()),
        round(analysis.toolTechScore()),
        round(analysis.seniorityScore()),
        round(semantic),
        round(combined),
        analysis.matchedSkills(),
        analysis.missingSkills(),
        analysis.explanation());
  }

  private CompletableFuture<AnalysisResult> analyzeAsync(
      String jobDescription, CandidateInput candidate) {
    CompletableFuture<AnalysisResult> analysis = new CompletableFuture<>();
    try {
      executor.execute(
          () -> {
            // Time spent queued for a worker does not count against the timeout.
            analysis.completeOnTimeout(
                AnalysisResult.fallback(TIMEOUT_EXPLANATION),
                timeoutMillis,
                TimeUnit.MILLISECONDS);
            try {
              analysis.complete(analyzer.analyze(jobDescription, candidate.text()));
            } catch (RuntimeException e) {
              analysis.completeExceptionally(e);
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Analysis of {} rejected by executor: {}", candidate.id(), e.getMessage());
      return CompletableFuture.completedFuture(AnalysisResult.fallback(FAILURE_EXPLANATION));
    }
    return analysis.exceptionally(
        e -> {
          log.warn("Analysis of {} failed: {}", candidate.id(), e.getMessage());
          return AnalysisResult.fallback(FAILURE_EXPLANATION);
        });
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(100.0, score));
  }

  static double round(double score) {
    return BigDecimal.valueOf(score).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
