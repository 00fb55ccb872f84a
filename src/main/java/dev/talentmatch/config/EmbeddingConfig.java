package dev.talentmatch.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding capability and the session-partitioned vector store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process, so
 * job descriptions and CVs never leave the host for embedding. The {@link PgVectorEmbeddingStore}
 * shares the application's HikariCP {@link DataSource}; its table is created by Flyway.
 *
 * @see dev.talentmatch.ingestion.VectorIndexer
 * @see dev.talentmatch.scoring.SemanticScorer
 */
@Configuration
public class EmbeddingConfig {

  /**
   * Provides the in-process ONNX embedding model.
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Builds the pgvector store after verifying that model, configuration and table agree on the
   * vector dimension.
   *
   * @param dataSource the shared data source (no duplicate pool)
   * @param embeddingModel the model whose dimension is checked
   * @param verifier startup dimension guard
   * @param properties table name and dimension
   * @return the vector store used as the session audit index
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(
      DataSource dataSource,
      EmbeddingModel embeddingModel,
      VectorStoreDimensionVerifier verifier,
      VectorProperties properties) {
    verifier.verify(embeddingModel.dimension());
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(properties.table())
        .dimension(properties.dimension())
        .createTable(false) // Schema managed by Flyway migrations
        .useIndex(false) // Audit index only, no similarity queries
        .build();
  }
}
