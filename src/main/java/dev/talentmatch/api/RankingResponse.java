package dev.talentmatch.api;

import dev.talentmatch.matching.RankingReport;
import dev.talentmatch.ranking.CandidateScore;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.IntStream;

/** JSON body of a ranking response. */
public record RankingResponse(
    String sessionId,
    List<Candidate> topCandidates,
    int totalCandidates,
    List<String> skippedFiles,
    double processingTimeSeconds) {

  /** One ranked candidate; {@code downloadUrl} points at the stored CV. */
  public record Candidate(
      int rank,
      String name,
      String fileName,
      String downloadUrl,
      double finalScore,
      double skillMatchScore,
      double experienceScore,
      double toolTechScore,
      double seniorityScore,
      double semanticScore,
      List<String> matchedSkills,
      List<String> missingSkills,
      String explanation) {}

  static RankingResponse from(RankingReport report) {
    String sessionId = report.sessionId().value();
    List<CandidateScore> scores = report.candidates();
    List<Candidate> candidates =
        IntStream.range(0, scores.size())
            .mapToObj(i -> toCandidate(sessionId, i + 1, scores.get(i)))
            .toList();
    return new RankingResponse(
        sessionId,
        candidates,
        report.totalCandidates(),
        report.skippedFiles(),
        report.processingTimeSeconds());
  }

  private static Candidate toCandidate(String sessionId, int rank, CandidateScore score) {
    String fileName = Path.of(score.sourcePath()).getFileName().toString();
    return new Candidate(
        rank,
        score.name(),
        fileName,
        "/api/sessions/" + sessionId + "/files/" + fileName,
        score.finalScore(),
        score.skillMatchScore(),
        score.experienceScore(),
        score.toolTechScore(),
        score.seniorityScore(),
        score.semanticScore(),
        score.matchedSkills(),
        score.missingSkills(),
        score.explanation());
  }
}
