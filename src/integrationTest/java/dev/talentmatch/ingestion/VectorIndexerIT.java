package dev.talentmatch.ingestion;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;
import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.talentmatch.BaseIntegrationTest;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class VectorIndexerIT extends BaseIntegrationTest {

  private static final String JD =
      "We are hiring a senior backend engineer with Java, Spring Boot and PostgreSQL experience.";

  @Autowired VectorIndexer vectorIndexer;
  @Autowired SessionManager sessionManager;
  @Autowired EmbeddingModel embeddingModel;

  @Test
  void ingestStoresOneVectorPerChunkWithSessionMetadata() {
    SessionId sessionId = sessionManager.create();

    List<String> keys =
        vectorIndexer.ingest(SessionDocument.jobDescription(sessionId, longText("Requirement")));

    List<EmbeddingMatch<TextSegment>> stored = storedFor(sessionId);
    assertThat(stored).hasSize(keys.size());
    assertThat(keys).allMatch(key -> key.startsWith("jd_" + sessionId.value() + "_job_"));
    assertThat(stored)
        .allSatisfy(
            match -> {
              assertThat(match.embedded().metadata().getString("session_id"))
                  .isEqualTo(sessionId.value());
              assertThat(match.embedded().metadata().getString("document_role"))
                  .isEqualTo("job_description");
            });
    sessionManager.cleanup(sessionId);
  }

  @Test
  void reingestingTheSameDocumentDoesNotDuplicateVectors() {
    SessionId sessionId = sessionManager.create();
    SessionDocument cv =
        SessionDocument.cv(sessionId, "jane_doe.pdf", longText("Skill"), null, "Jane Doe");

    List<String> first = vectorIndexer.ingest(cv);
    List<String> second = vectorIndexer.ingest(cv);

    assertThat(second).isEqualTo(first);
    assertThat(storedFor(sessionId)).hasSize(first.size());
    sessionManager.cleanup(sessionId);
  }

  @Test
  void deleteSessionRemovesOnlyThatSession() {
    SessionId removed = sessionManager.create();
    SessionId kept = sessionManager.create();
    vectorIndexer.ingest(SessionDocument.jobDescription(removed, JD));
    vectorIndexer.ingest(SessionDocument.jobDescription(kept, JD));

    vectorIndexer.deleteSession(removed);

    assertThat(storedFor(removed)).isEmpty();
    assertThat(storedFor(kept)).isNotEmpty();
    sessionManager.cleanup(removed);
    sessionManager.cleanup(kept);
  }

  private List<EmbeddingMatch<TextSegment>> storedFor(SessionId sessionId) {
    Embedding query = embeddingModel.embed(JD).content();
    return embeddingStore
        .search(
            EmbeddingSearchRequest.builder()
                .queryEmbedding(query)
                .filter(metadataKey("session_id").isEqualTo(sessionId.value()))
                .maxResults(1000)
                .minScore(0.0)
                .build())
        .matches();
  }

  private static String longText(String prefix) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      text.append(prefix).append(' ').append(i).append(": ").append(JD).append("\n\n");
    }
    return text.toString();
  }
}
