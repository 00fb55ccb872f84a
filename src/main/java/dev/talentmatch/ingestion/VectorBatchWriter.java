package dev.talentmatch.ingestion;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/**
 * Embeds one batch of chunks and upserts it into the embedding store.
 *
 * <p>Upsert is implemented as remove-by-id followed by add, so writing the same chunks twice leaves
 * exactly one record per chunk. Transient failures are retried with exponential backoff; once
 * retries are exhausted the failure surfaces as an {@link IngestionException}.
 */
@Component
public class VectorBatchWriter {

  private static final Logger log = LoggerFactory.getLogger(VectorBatchWriter.class);

  private final EmbeddingModel embeddingModel;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final IndexingProperties properties;

  public VectorBatchWriter(
      EmbeddingModel embeddingModel,
      EmbeddingStore<TextSegment> embeddingStore,
      IndexingProperties properties) {
    this.embeddingModel = embeddingModel;
    this.embeddingStore = embeddingStore;
    this.properties = properties;
  }

  /**
   * Writes the batch.
   *
   * @param batch non-empty list of chunks, at most {@code talentmatch.indexing.batch-size} long
   * @return the store ids written, in batch order
   */
  @Retryable(
      retryFor = RuntimeException.class,
      maxAttemptsExpression = "${talentmatch.indexing.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${talentmatch.indexing.retry.delay-ms:500}",
              multiplierExpression = "${talentmatch.indexing.retry.multiplier:2.0}"))
  public List<String> write(List<ChunkData> batch) {
    List<String> ids = batch.stream().map(ChunkData::vectorId).toList();
    List<TextSegment> segments =
        batch.stream().map(chunk -> chunk.toTextSegment(properties.excerptLength())).toList();
    List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
    embeddingStore.removeAll(ids);
    embeddingStore.addAll(ids, embeddings, segments);
    log.debug("Upserted batch of {} chunks", ids.size());
    return ids;
  }

  @Recover
  List<String> recoverWrite(RuntimeException e, List<ChunkData> batch) {
    log.warn("Vector batch of {} chunks failed after retries: {}", batch.size(), e.getMessage());
    throw new IngestionException("Vector batch of " + batch.size() + " chunks failed", e);
  }
}
