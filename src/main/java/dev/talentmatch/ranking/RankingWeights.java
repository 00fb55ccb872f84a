package dev.talentmatch.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Weights of the five signals combined into a candidate's final score.
 *
 * <p>Properties are bound from {@code talentmatch.ranking.weights.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code skill-match} - share of required skills found (default 0.40)
 *   <li>{@code experience} - relevance of experience (default 0.25)
 *   <li>{@code tool-tech} - alignment with required tools and technologies (default 0.20)
 *   <li>{@code seniority} - seniority-level match (default 0.10)
 *   <li>{@code semantic} - whole-document embedding similarity (default 0.05)
 * </ul>
 *
 * <p>Each weight must lie in [0.0, 1.0] and together they must sum to 1.0. Validated at startup
 * via {@link #validate()}; the application fails to start otherwise.
 */
@Configuration
@ConfigurationProperties(prefix = "talentmatch.ranking.weights")
public class RankingWeights {

  static final double SUM_TOLERANCE = 1e-9;

  private double skillMatch = 0.40;
  private double experience = 0.25;
  private double toolTech = 0.20;
  private double seniority = 0.10;
  private double semantic = 0.05;

  /** Builds a validated weight set outside of Spring binding. */
  public static RankingWeights of(
      double skillMatch, double experience, double toolTech, double seniority, double semantic) {
    RankingWeights weights = new RankingWeights();
    weights.setSkillMatch(skillMatch);
    weights.setExperience(experience);
    weights.setToolTech(toolTech);
    weights.setSeniority(seniority);
    weights.setSemantic(semantic);
    weights.validate();
    return weights;
  }

  /** Default weight set (0.40, 0.25, 0.20, 0.10, 0.05). */
  public static RankingWeights defaults() {
    RankingWeights weights = new RankingWeights();
    weights.validate();
    return weights;
  }

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireUnitInterval("skill-match", skillMatch);
    requireUnitInterval("experience", experience);
    requireUnitInterval("tool-tech", toolTech);
    requireUnitInterval("seniority", seniority);
    requireUnitInterval("semantic", semantic);
    double sum = sum();
    if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
      throw new IllegalStateException(
          "talentmatch.ranking.weights must sum to 1.0, got: " + sum);
    }
  }

  /**
   * Linear combination of the five scores, each expected on the [0, 100] scale.
   *
   * @return the weighted score, unclamped and unrounded
   */
  public double combine(
      double skillMatchScore,
      double experienceScore,
      double toolTechScore,
      double seniorityScore,
      double semanticScore) {
    return skillMatchScore * skillMatch
        + experienceScore * experience
        + toolTechScore * toolTech
        + seniorityScore * seniority
        + semanticScore * semantic;
  }

  public double sum() {
    return skillMatch + experience + toolTech + seniority + semantic;
  }

  private static void requireUnitInterval(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "talentmatch.ranking.weights." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  public double getSkillMatch() {
    return skillMatch;
  }

  public void setSkillMatch(double skillMatch) {
    this.skillMatch = skillMatch;
  }

  public double getExperience() {
    return experience;
  }

  public void setExperience(double experience) {
    this.experience = experience;
  }

  public double getToolTech() {
    return toolTech;
  }

  public void setToolTech(double toolTech) {
    this.toolTech = toolTech;
  }

  public double getSeniority() {
    return seniority;
  }

  public void setSeniority(double seniority) {
    this.seniority = seniority;
  }

  public double getSemantic() {
    return semantic;
  }

  public void setSemantic(double semantic) {
    this.semantic = semantic;
  }
}
