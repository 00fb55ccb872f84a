package dev.talentmatch.ingestion;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.talentmatch.session.SessionId;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * One chunk of a {@link SessionDocument}, ready for embedding.
 *
 * @param sessionId owning session
 * @param role role of the source document
 * @param documentKey key of the source document within the session
 * @param chunkIndex zero-based position within the document
 * @param text chunk body
 * @param sourcePath stored upload path as a string; null for the job description
 * @param candidateName candidate display name; null for the job description
 */
public record ChunkData(
    SessionId sessionId,
    DocumentRole role,
    String documentKey,
    int chunkIndex,
    String text,
    @Nullable String sourcePath,
    @Nullable String candidateName) {

  public ChunkData {
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    Objects.requireNonNull(role, "role must not be null");
    Objects.requireNonNull(documentKey, "documentKey must not be null");
    Objects.requireNonNull(text, "text must not be null");
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must not be negative");
    }
  }

  /** Deterministic identity key: {@code {role}_{sessionId}_{documentKey}_{chunkIndex}}. */
  public String key() {
    return role.keyPrefix() + "_" + sessionId.value() + "_" + documentKey + "_" + chunkIndex;
  }

  /** Store id derived from {@link #key()}; the same key always maps to the same UUID. */
  public String vectorId() {
    return UUID.nameUUIDFromBytes(key().getBytes(StandardCharsets.UTF_8)).toString();
  }

  /**
   * Converts chunk metadata to a langchain4j {@link Metadata} instance with snake_case keys used by
   * the EmbeddingStore.
   *
   * @param excerptLength maximum length of the diagnostic {@code excerpt} entry
   */
  public Metadata toMetadata(int excerptLength) {
    Metadata metadata =
        Metadata.from("session_id", sessionId.value())
            .put("document_role", role.value())
            .put("chunk_index", chunkIndex)
            .put("chunk_key", key())
            .put("excerpt", text.length() <= excerptLength ? text : text.substring(0, excerptLength));
    if (sourcePath != null) {
      metadata.put("source_path", sourcePath);
    }
    if (candidateName != null) {
      metadata.put("candidate_name", candidateName);
    }
    return metadata;
  }

  /** Converts this chunk to a langchain4j {@link TextSegment} ready for embedding. */
  public TextSegment toTextSegment(int excerptLength) {
    return TextSegment.from(text, toMetadata(excerptLength));
  }
}
