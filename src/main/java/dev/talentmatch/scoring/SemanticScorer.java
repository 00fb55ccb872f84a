package dev.talentmatch.scoring;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Document-level semantic similarity between a job description and a candidate document.
 *
 * <p>Both texts are truncated to {@code talentmatch.semantic.max-chars} characters and embedded as
 * single vectors with the same {@link EmbeddingModel} used for indexing. The score is their cosine
 * similarity floored at 0, so it always lies in
 * [0, 1]. Blank input scores 0 without calling the model.
 */
@Component
public class SemanticScorer {

  private static final Logger log = LoggerFactory.getLogger(SemanticScorer.class);

  private final EmbeddingModel embeddingModel;
  private final int maxChars;

  public SemanticScorer(EmbeddingModel embeddingModel, SemanticProperties properties) {
    this.embeddingModel = embeddingModel;
    this.maxChars = properties.maxChars();
  }

  public double similarity(@Nullable String jobDescription, @Nullable String candidateText) {
    if (isBlank(jobDescription) || isBlank(candidateText)) {
      return 0.0;
    }
    return similarity(embed(jobDescription), candidateText);
  }

  /**
   * Scores every candidate against the job description, embedding the job description once.
   *
   * @param jobDescription job description text
   * @param candidates candidate identity to candidate text
   * @return candidate identity to score in [0, 1], in the iteration order of {@code candidates}
   */
  public Map<String, Double> similarities(
      @Nullable String jobDescription, Map<String, String> candidates) {
    Map<String, Double> scores = new LinkedHashMap<>();
    if (isBlank(jobDescription)) {
      candidates.keySet().forEach(id -> scores.put(id, 0.0));
      return scores;
    }
    Embedding jobEmbedding = embed(jobDescription);
    candidates.forEach(
        (id, text) -> scores.put(id, isBlank(text) ? 0.0 : similarity(jobEmbedding, text)));
    log.debug("Computed semantic similarity for {} candidates", scores.size());
    return scores;
  }

  private double similarity(Embedding jobEmbedding, String candidateText) {
    double cosine = CosineSimilarity.between(jobEmbedding, embed(candidateText));
    return Math.min(1.0, Math.max(0.0, cosine));
  }

  private Embedding embed(String text) {
    String truncated = text.length() > maxChars ? text.substring(0, maxChars) : text;
    return embeddingModel.embed(truncated).content();
  }

  private static boolean isBlank(@Nullable String text) {
    return text == null || text.isBlank();
  }
}
