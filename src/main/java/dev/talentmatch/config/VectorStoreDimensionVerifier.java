package dev.talentmatch.config;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Startup guard that refuses to build the vector store when the embedding model, the configured
 * dimension and the pgvector column disagree.
 *
 * <p>A mismatch is a configuration fault: it throws {@link IllegalStateException}, which aborts
 * application context startup so no ranking request is ever served with wrong similarity data.
 */
@Component
public class VectorStoreDimensionVerifier {

  private static final Logger log = LoggerFactory.getLogger(VectorStoreDimensionVerifier.class);

  /** For pgvector columns {@code atttypmod} holds the declared dimension. */
  static final String COLUMN_DIMENSION_SQL =
      "SELECT a.atttypmod FROM pg_attribute a "
          + "WHERE a.attrelid = to_regclass(?) AND a.attname = 'embedding' AND NOT a.attisdropped";

  private final JdbcTemplate jdbcTemplate;
  private final VectorProperties properties;

  public VectorStoreDimensionVerifier(JdbcTemplate jdbcTemplate, VectorProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.properties = properties;
  }

  /**
   * Checks the model dimension and the store column dimension against the configured value.
   *
   * @param modelDimension dimension reported by the embedding model
   * @throws IllegalStateException on any mismatch or when the table does not exist
   */
  public void verify(int modelDimension) {
    int configured = properties.dimension();
    if (modelDimension != configured) {
      throw new IllegalStateException(
          "Embedding model produces "
              + modelDimension
              + "-dimension vectors but talentmatch.vector.dimension is "
              + configured);
    }

    List<Integer> columnDimensions =
        jdbcTemplate.queryForList(COLUMN_DIMENSION_SQL, Integer.class, properties.table());
    if (columnDimensions.isEmpty()) {
      throw new IllegalStateException(
          "Vector table '" + properties.table() + "' with an 'embedding' column does not exist");
    }
    int storeDimension = columnDimensions.get(0);
    if (storeDimension != configured) {
      throw new IllegalStateException(
          "Vector table '"
              + properties.table()
              + "' stores "
              + storeDimension
              + "-dimension vectors but talentmatch.vector.dimension is "
              + configured
              + "; recreate the table or fix the configuration");
    }
    log.info("Vector dimension verified: model=store={} ({})", configured, properties.table());
  }
}
