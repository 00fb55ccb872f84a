package dev.talentmatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Vector store settings bound from {@code talentmatch.vector.*}.
 *
 * @param dimension embedding dimension the store column was created with; the embedding model
 *     must produce vectors of exactly this size
 * @param table pgvector table holding session chunks
 */
@ConfigurationProperties(prefix = "talentmatch.vector")
public record VectorProperties(
    @DefaultValue("384") int dimension, @DefaultValue("candidate_chunks") String table) {

  public VectorProperties {
    if (dimension < 1) {
      throw new IllegalStateException(
          "talentmatch.vector.dimension must be positive, got: " + dimension);
    }
    if (table == null || !table.matches("[a-z_][a-z0-9_]*")) {
      throw new IllegalStateException(
          "talentmatch.vector.table must be a plain lower-case identifier, got: " + table);
    }
  }
}
