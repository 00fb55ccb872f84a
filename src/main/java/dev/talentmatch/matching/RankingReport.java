package dev.talentmatch.matching;

import dev.talentmatch.ranking.CandidateScore;
import dev.talentmatch.session.SessionId;
import java.util.List;

/**
 * Outcome of one ranking request.
 *
 * @param sessionId session holding the stored uploads, valid until cleaned up or swept
 * @param candidates top candidates, best first
 * @param totalCandidates number of candidates that were ranked
 * @param skippedFiles uploads whose text could not be extracted
 * @param processingTimeSeconds wall-clock duration of the request, two decimal places
 */
public record RankingReport(
    SessionId sessionId,
    List<CandidateScore> candidates,
    int totalCandidates,
    List<String> skippedFiles,
    double processingTimeSeconds) {

  public RankingReport {
    candidates = List.copyOf(candidates);
    skippedFiles = List.copyOf(skippedFiles);
  }
}
