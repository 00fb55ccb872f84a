package dev.talentmatch.ingestion;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Vector indexing settings bound from {@code talentmatch.indexing.*}.
 *
 * @param batchSize maximum records per embedding-store write
 * @param excerptLength maximum length of the text excerpt kept in chunk metadata
 * @param retry retry policy for a failed batch; read by {@link VectorBatchWriter} through property
 *     expressions
 */
@ConfigurationProperties(prefix = "talentmatch.indexing")
public record IndexingProperties(
    @DefaultValue("100") int batchSize,
    @DefaultValue("500") int excerptLength,
    @DefaultValue Retry retry) {

  public IndexingProperties {
    if (batchSize < 1 || batchSize > 1000) {
      throw new IllegalStateException(
          "talentmatch.indexing.batch-size must be in [1, 1000], got: " + batchSize);
    }
    if (excerptLength < 0) {
      throw new IllegalStateException(
          "talentmatch.indexing.excerpt-length must not be negative, got: " + excerptLength);
    }
  }

  public record Retry(
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("500") long delayMs,
      @DefaultValue("2.0") double multiplier) {}
}
