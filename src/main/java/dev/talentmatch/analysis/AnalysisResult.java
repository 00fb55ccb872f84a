package dev.talentmatch.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Normalised outcome of one candidate assessment. Always fully populated: sub-scores are clamped to
 * [0, 100] (NaN becomes 0) and skill lists are never null.
 *
 * @param candidateName name reported by the assessment, {@value #UNKNOWN_CANDIDATE} if absent
 * @param skillMatchScore share of required skills found in the CV
 * @param experienceScore relevance of the candidate's experience
 * @param toolTechScore alignment with required tools and technologies
 * @param seniorityScore match with the required seniority level
 * @param matchedSkills required skills present in the CV
 * @param missingSkills required skills absent from the CV
 * @param explanation short verdict, or the reason the assessment could not be made
 */
public record AnalysisResult(
    String candidateName,
    double skillMatchScore,
    double experienceScore,
    double toolTechScore,
    double seniorityScore,
    List<String> matchedSkills,
    List<String> missingSkills,
    String explanation) {

  public static final String UNKNOWN_CANDIDATE = "Unknown";
  public static final String DEFAULT_EXPLANATION = "Analysis completed.";

  public AnalysisResult {
    Objects.requireNonNull(candidateName, "candidateName must not be null");
    Objects.requireNonNull(explanation, "explanation must not be null");
    skillMatchScore = clamp(skillMatchScore);
    experienceScore = clamp(experienceScore);
    toolTechScore = clamp(toolTechScore);
    seniorityScore = clamp(seniorityScore);
    matchedSkills = matchedSkills == null ? List.of() : List.copyOf(matchedSkills);
    missingSkills = missingSkills == null ? List.of() : List.copyOf(missingSkills);
  }

  /** Degraded result: unknown candidate, all scores 0, no skills. */
  public static AnalysisResult fallback(String explanation) {
    return new AnalysisResult(
        UNKNOWN_CANDIDATE, 0.0, 0.0, 0.0, 0.0, List.of(), List.of(), explanation);
  }

  /** True when the assessment did not report a usable candidate name. */
  public boolean hasUnknownName() {
    return candidateName.isBlank() || UNKNOWN_CANDIDATE.equals(candidateName);
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(100.0, score));
  }
}
