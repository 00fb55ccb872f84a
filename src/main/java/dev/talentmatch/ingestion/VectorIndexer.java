package dev.talentmatch.ingestion;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.talentmatch.ingestion.chunking.RecursiveTextChunker;
import dev.talentmatch.session.SessionClosedException;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chunks session documents, embeds the chunks and stores them in the session partition of the
 * embedding store.
 *
 * <p><strong>Write semantics:</strong> a document's chunks are written in sequential batches of at
 * most {@code talentmatch.indexing.batch-size}. Ingestion of one document is all-or-nothing from
 * the caller's point of view: when a batch fails after retries, or the session is cleaned up while
 * batches are still being written, every vector already written for that document is removed
 * before the exception propagates.
 *
 * <p>The store is a write-only side index: nothing in the ranking path queries it. It is partitioned
 * by the {@code session_id} metadata key, which is also how {@link #deleteSession(SessionId)} finds
 * the vectors to remove.
 */
@Service
public class VectorIndexer {

  private static final Logger log = LoggerFactory.getLogger(VectorIndexer.class);

  static final String SESSION_ID_KEY = "session_id";

  private final RecursiveTextChunker chunker;
  private final VectorBatchWriter batchWriter;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final SessionManager sessionManager;
  private final IndexingProperties properties;

  public VectorIndexer(
      RecursiveTextChunker chunker,
      VectorBatchWriter batchWriter,
      EmbeddingStore<TextSegment> embeddingStore,
      SessionManager sessionManager,
      IndexingProperties properties) {
    this.chunker = chunker;
    this.batchWriter = batchWriter;
    this.embeddingStore = embeddingStore;
    this.sessionManager = sessionManager;
    this.properties = properties;
  }

  /**
   * Ingests one document into its session partition.
   *
   * @param document the document to index
   * @return chunk identity keys in chunk order; empty if the text produced no chunks
   * @throws SessionClosedException if the session is not active, before or during the write
   * @throws IngestionException if a batch could not be written
   */
  public List<String> ingest(SessionDocument document) {
    SessionId sessionId = document.sessionId();
    sessionManager.requireActive(sessionId);

    List<ChunkData> chunks = toChunks(document);
    if (chunks.isEmpty()) {
      log.debug("No chunks for {} {} in session {}", document.role().value(),
          document.documentKey(), sessionId);
      return List.of();
    }

    List<String> attempted = new ArrayList<>();
    int batchSize = properties.batchSize();
    try {
      for (int i = 0; i < chunks.size(); i += batchSize) {
        List<ChunkData> batch = chunks.subList(i, Math.min(i + batchSize, chunks.size()));
        batch.forEach(chunk -> attempted.add(chunk.vectorId()));
        batchWriter.write(batch);
        sessionManager.requireActive(sessionId);
      }
    } catch (SessionClosedException e) {
      rollback(attempted, e);
      throw e;
    } catch (IngestionException e) {
      rollback(attempted, e);
      throw e;
    } catch (RuntimeException e) {
      IngestionException failure =
          new IngestionException(
              "Could not index " + document.documentKey() + " for session " + sessionId, e);
      rollback(attempted, failure);
      throw failure;
    }

    log.info("Indexed {} chunks of {} {} in session {}", chunks.size(),
        document.role().value(), document.documentKey(), sessionId);
    return chunks.stream().map(ChunkData::key).toList();
  }

  /**
   * Ingests several documents one after another.
   *
   * @return all chunk identity keys, grouped by document in input order
   */
  public List<String> ingestAll(List<SessionDocument> documents) {
    List<String> keys = new ArrayList<>();
    for (SessionDocument document : documents) {
      keys.addAll(ingest(document));
    }
    return keys;
  }

  /**
   * Removes every vector tagged with the session id, whatever its role or chunk count. Deleting an
   * unknown or already deleted session is a no-op.
   *
   * @throws VectorStoreException if the store rejects the delete
   */
  public void deleteSession(SessionId sessionId) {
    try {
      embeddingStore.removeAll(metadataKey(SESSION_ID_KEY).isEqualTo(sessionId.value()));
    } catch (RuntimeException e) {
      log.error("Could not delete vectors of session {}: {}", sessionId, e.getMessage());
      throw new VectorStoreException("Could not delete vectors of session " + sessionId, e);
    }
    log.info("Deleted vectors of session {}", sessionId);
  }

  List<ChunkData> toChunks(SessionDocument document) {
    List<String> texts = chunker.split(document.text());
    String sourcePath = document.sourcePath() == null ? null : document.sourcePath().toString();
    List<ChunkData> chunks = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      chunks.add(
          new ChunkData(
              document.sessionId(),
              document.role(),
              document.documentKey(),
              i,
              texts.get(i),
              sourcePath,
              document.candidateName()));
    }
    return chunks;
  }

  private void rollback(List<String> ids, RuntimeException cause) {
    if (ids.isEmpty()) {
      return;
    }
    try {
      embeddingStore.removeAll(ids);
      log.warn("Rolled back {} vectors after failed ingestion: {}", ids.size(), cause.getMessage());
    } catch (RuntimeException e) {
      log.error("Rollback of {} vectors failed: {}", ids.size(), e.getMessage());
      cause.addSuppressed(e);
    }
  }
}
