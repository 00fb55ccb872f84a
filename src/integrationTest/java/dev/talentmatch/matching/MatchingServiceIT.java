package dev.talentmatch.matching;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.talentmatch.BaseIntegrationTest;
import dev.talentmatch.ranking.CandidateScore;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class MatchingServiceIT extends BaseIntegrationTest {

  private static final String JD =
      "Senior Java engineer. Required: Java, Spring Boot, PostgreSQL. Five years of experience.";

  @Autowired MatchingService matchingService;
  @Autowired SessionManager sessionManager;
  @Autowired EmbeddingModel embeddingModel;

  @Test
  void ranksCandidatesEndToEndAndCleansUp() {
    when(chatModel.chat(anyString()))
        .thenAnswer(
            invocation -> {
              String prompt = invocation.getArgument(0);
              if (prompt.contains("Jane Doe")) {
                return reply("Jane Doe", 90, 85, 90, 80);
              }
              return reply("Unknown", 30, 20, 25, 10);
            });

    RankingReport report =
        matchingService.rank(
            JD,
            List.of(
                upload("john_smith.txt", "Gardener with ten years of landscaping work."),
                upload(
                    "jane_doe.txt",
                    "Jane Doe\nSenior Java engineer, Spring Boot and PostgreSQL, seven years.")),
            2);

    SessionId sessionId = report.sessionId();
    assertThat(report.totalCandidates()).isEqualTo(2);
    assertThat(report.skippedFiles()).isEmpty();
    assertThat(report.candidates())
        .extracting(CandidateScore::name)
        .containsExactly("Jane Doe", "John Smith");
    CandidateScore best = report.candidates().get(0);
    assertThat(best.finalScore()).isGreaterThan(report.candidates().get(1).finalScore());
    assertThat(best.semanticScore()).isBetween(0.0, 100.0);
    assertThat(sessionManager.resolve(sessionId, "jane_doe.txt")).isPresent();
    assertThat(storedVectors(sessionId)).isGreaterThanOrEqualTo(3);

    assertThat(matchingService.cleanup(sessionId)).isTrue();

    assertThat(storedVectors(sessionId)).isZero();
    assertThat(sessionManager.resolve(sessionId, "jane_doe.txt")).isEmpty();
  }

  @Test
  void analysisFailureKeepsCandidateWithZeroScore() {
    when(chatModel.chat(contains("Alice"))).thenReturn(reply("Alice Martin", 70, 70, 70, 70));
    when(chatModel.chat(contains("Bob"))).thenThrow(new RuntimeException("rate limited"));

    RankingReport report =
        matchingService.rank(
            JD,
            List.of(
                upload("alice.txt", "Alice Martin\nJava developer"),
                upload("bob.txt", "Bob Stone\nJava developer")),
            5);

    assertThat(report.candidates()).hasSize(2);
    assertThat(report.candidates().get(1).finalScore()).isZero();
    matchingService.cleanup(report.sessionId());
  }

  private int storedVectors(SessionId sessionId) {
    return embeddingStore
        .search(
            EmbeddingSearchRequest.builder()
                .queryEmbedding(embeddingModel.embed(JD).content())
                .filter(metadataKey("session_id").isEqualTo(sessionId.value()))
                .maxResults(1000)
                .minScore(0.0)
                .build())
        .matches()
        .size();
  }

  private static UploadedDocument upload(String filename, String text) {
    return new UploadedDocument(filename, text.getBytes(StandardCharsets.UTF_8));
  }

  private static String reply(String name, int skills, int experience, int tools, int seniority) {
    return """
        {"candidate_name": "%s", "skill_match_score": %d, "experience_score": %d,
         "tool_tech_score": %d, "seniority_score": %d,
         "matched_skills": ["Java"], "missing_skills": [], "explanation": "ok"}
        """
        .formatted(name, skills, experience, tools, seniority);
  }
}
