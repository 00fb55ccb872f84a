package dev.talentmatch.ranking;

import java.util.List;
import java.util.Objects;

/**
 * Final ranking record of one candidate. All scores are on the [0, 100] scale, rounded to two
 * decimal places.
 *
 * @param name candidate display name
 * @param sourcePath stored upload the candidate was read from
 * @param skillMatchScore skill match sub-score
 * @param experienceScore experience sub-score
 * @param toolTechScore tools and technologies sub-score
 * @param seniorityScore seniority sub-score
 * @param semanticScore whole-document similarity scaled to [0, 100]
 * @param finalScore weighted combination of the five sub-scores
 * @param matchedSkills skills found in the CV
 * @param missingSkills required skills absent from the CV
 * @param explanation assessment verdict or failure reason
 */
public record CandidateScore(
    String name,
    String sourcePath,
    double skillMatchScore,
    double experienceScore,
    double toolTechScore,
    double seniorityScore,
    double semanticScore,
    double finalScore,
    List<String> matchedSkills,
    List<String> missingSkills,
    String explanation) {

  public CandidateScore {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(sourcePath, "sourcePath must not be null");
    Objects.requireNonNull(explanation, "explanation must not be null");
    requireScore("skillMatchScore", skillMatchScore);
    requireScore("experienceScore", experienceScore);
    requireScore("toolTechScore", toolTechScore);
    requireScore("seniorityScore", seniorityScore);
    requireScore("semanticScore", semanticScore);
    requireScore("finalScore", finalScore);
    matchedSkills = List.copyOf(matchedSkills);
    missingSkills = List.copyOf(missingSkills);
  }

  private static void requireScore(String field, double value) {
    if (!(value >= 0.0 && value <= 100.0)) {
      throw new IllegalArgumentException(field + " must be in [0, 100], got: " + value);
    }
  }
}
