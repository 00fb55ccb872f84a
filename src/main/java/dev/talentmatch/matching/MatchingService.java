package dev.talentmatch.matching;

import dev.talentmatch.analysis.CandidateAnalyzer;
import dev.talentmatch.analysis.JobRequirements;
import dev.talentmatch.ingestion.CandidateNameExtractor;
import dev.talentmatch.ingestion.DocumentExtractionException;
import dev.talentmatch.ingestion.DocumentTextExtractor;
import dev.talentmatch.ingestion.SessionDocument;
import dev.talentmatch.ingestion.VectorIndexer;
import dev.talentmatch.ingestion.VectorStoreException;
import dev.talentmatch.ranking.CandidateInput;
import dev.talentmatch.ranking.CandidateScore;
import dev.talentmatch.ranking.RankingEngine;
import dev.talentmatch.scoring.SemanticScorer;
import dev.talentmatch.session.SessionClosedException;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a complete ranking request: session → store uploads → extract text → index → semantic
 * scores → weighted ranking → top N.
 *
 * <p>Any failure after the session was created tears the session down (vectors, then files) before
 * the exception propagates. A session closed while the request runs fails it with {@link
 * SessionClosedException}. On success the session stays open so stored CVs can be downloaded; it
 * is closed by {@link #cleanup(SessionId)} or by the expiry sweep.
 */
@Service
public class MatchingService {

  private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

  private final SessionManager sessionManager;
  private final DocumentTextExtractor textExtractor;
  private final VectorIndexer vectorIndexer;
  private final SemanticScorer semanticScorer;
  private final RankingEngine rankingEngine;
  private final CandidateAnalyzer candidateAnalyzer;

  public MatchingService(
      SessionManager sessionManager,
      DocumentTextExtractor textExtractor,
      VectorIndexer vectorIndexer,
      SemanticScorer semanticScorer,
      RankingEngine rankingEngine,
      CandidateAnalyzer candidateAnalyzer) {
    this.sessionManager = sessionManager;
    this.textExtractor = textExtractor;
    this.vectorIndexer = vectorIndexer;
    this.semanticScorer = semanticScorer;
    this.rankingEngine = rankingEngine;
    this.candidateAnalyzer = candidateAnalyzer;
  }

  /**
   * Ranks uploaded CVs against a job description.
   *
   * @param jobDescription job description text, must not be blank
   * @param uploads CV files with distinct plain file names
   * @param topN number of candidates to return, at least 1
   * @return the report; candidates that could not be assessed are kept with score 0
   * @throws IllegalArgumentException on blank job description, no uploads or {@code topN < 1}
   * @throws DocumentExtractionException if no upload yields any text
   * @throws SessionClosedException if the session was closed before the report was built
   */
  public RankingReport rank(String jobDescription, List<UploadedDocument> uploads, int topN) {
    if (jobDescription == null || jobDescription.isBlank()) {
      throw new IllegalArgumentException("Job description must not be blank");
    }
    if (uploads.isEmpty()) {
      throw new IllegalArgumentException("At least one CV is required");
    }
    if (topN < 1) {
      throw new IllegalArgumentException("topN must be at least 1, got: " + topN);
    }

    long started = System.nanoTime();
    SessionId sessionId = sessionManager.create();
    try {
      List<SessionDocument> cvDocuments = new ArrayList<>();
      List<String> skipped = new ArrayList<>();
      for (UploadedDocument upload : uploads) {
        Path stored = sessionManager.save(sessionId, upload.filename(), upload.content());
        String text = extractOrSkip(stored);
        if (text == null) {
          skipped.add(upload.filename());
          continue;
        }
        cvDocuments.add(
            SessionDocument.cv(
                sessionId,
                upload.filename(),
                text,
                stored,
                CandidateNameExtractor.extract(upload.filename(), text)));
      }
      if (cvDocuments.isEmpty()) {
        throw new DocumentExtractionException("No text could be extracted from the uploaded CVs");
      }

      vectorIndexer.ingest(SessionDocument.jobDescription(sessionId, jobDescription));
      vectorIndexer.ingestAll(cvDocuments);

      Map<String, String> texts = new LinkedHashMap<>();
      List<CandidateInput> candidates = new ArrayList<>();
      for (SessionDocument cv : cvDocuments) {
        texts.put(cv.documentKey(), cv.text());
        candidates.add(
            new CandidateInput(
                cv.documentKey(),
                String.valueOf(cv.candidateName()),
                String.valueOf(cv.sourcePath()),
                cv.text()));
      }
      Map<String, Double> similarities = semanticScorer.similarities(jobDescription, texts);
      List<CandidateScore> ranked = rankingEngine.rank(jobDescription, candidates, similarities);

      sessionManager.requireActive(sessionId);
      double seconds = seconds(System.nanoTime() - started);
      log.info("Ranked {} candidates in session {} in {}s ({} skipped)", ranked.size(), sessionId,
          seconds, skipped.size());
      return new RankingReport(
          sessionId, RankingEngine.top(ranked, topN), ranked.size(), skipped, seconds);
    } catch (RuntimeException e) {
      log.warn("Ranking failed in session {}, cleaning up: {}", sessionId, e.getMessage());
      try {
        cleanup(sessionId);
      } catch (RuntimeException cleanupFailure) {
        e.addSuppressed(cleanupFailure);
      }
      throw e;
    }
  }

  /**
   * Closes a session and removes its vectors, then its files. Safe to call repeatedly.
   *
   * <p>If the vectors cannot be deleted the session directory is kept, so the expiry sweep finds
   * the session again and retries.
   *
   * @return true if stored files were removed, false if there were none left
   * @throws VectorStoreException if the vectors could not be deleted; files are left in place
   */
  public boolean cleanup(SessionId sessionId) {
    sessionManager.deactivate(sessionId);
    vectorIndexer.deleteSession(sessionId);
    return sessionManager.cleanup(sessionId);
  }

  public JobRequirements extractRequirements(String jobDescription) {
    return candidateAnalyzer.extractRequirements(jobDescription);
  }

  private @Nullable String extractOrSkip(Path stored) {
    try {
      String text = textExtractor.extract(stored);
      if (text.isBlank()) {
        log.warn("No text in {}, skipping", stored.getFileName());
        return null;
      }
      return text;
    } catch (DocumentExtractionException e) {
      log.warn("Skipping unreadable upload {}: {}", stored.getFileName(), e.getMessage());
      return null;
    }
  }

  private static double seconds(long nanos) {
    return BigDecimal.valueOf(nanos)
        .divide(BigDecimal.valueOf(1_000_000_000L), 2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
