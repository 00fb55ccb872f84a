package dev.talentmatch.ingestion.chunking;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Chunker settings bound from {@code talentmatch.chunking.*}.
 *
 * @param chunkSize maximum chunk length in characters
 * @param overlap characters carried over from one chunk into the next; must be smaller than
 *     {@code chunkSize}
 */
@ConfigurationProperties(prefix = "talentmatch.chunking")
public record ChunkingProperties(@DefaultValue("1000") int chunkSize, @DefaultValue("200") int overlap) {

  public ChunkingProperties {
    if (chunkSize < 1) {
      throw new IllegalStateException(
          "talentmatch.chunking.chunk-size must be positive, got: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalStateException(
          "talentmatch.chunking.overlap must be in [0, chunk-size), got: " + overlap);
    }
  }
}
