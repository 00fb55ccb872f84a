package dev.talentmatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.talentmatch.config.VectorProperties;
import dev.talentmatch.ranking.RankingWeights;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

class ApplicationContextIT extends BaseIntegrationTest {

  @Autowired EmbeddingModel embeddingModel;
  @Autowired VectorProperties vectorProperties;
  @Autowired RankingWeights rankingWeights;
  @Autowired JdbcTemplate jdbcTemplate;

  @Test
  void modelAndStoreAgreeOnDimension() {
    assertThat(embeddingModel.dimension()).isEqualTo(vectorProperties.dimension()).isEqualTo(384);
  }

  @Test
  void flywayCreatedChunkTableWithSessionIndex() {
    Integer indexes =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pg_indexes WHERE indexname = 'idx_candidate_chunks_session_id'",
            Integer.class);

    assertThat(indexes).isEqualTo(1);
  }

  @Test
  void defaultWeightsAreBound() {
    assertThat(rankingWeights.getSkillMatch()).isEqualTo(0.40);
    assertThat(rankingWeights.sum()).isCloseTo(1.0, within(1e-9));
  }
}
