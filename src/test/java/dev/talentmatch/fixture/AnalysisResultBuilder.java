package dev.talentmatch.fixture;

import dev.talentmatch.analysis.AnalysisResult;
import java.util.List;

/**
 * Lightweight test builder for {@link AnalysisResult}. Provides sensible defaults so tests only
 * override what they care about.
 *
 * <pre>{@code
 * AnalysisResult result = new AnalysisResultBuilder().scores(80, 70, 90, 60).build();
 * }</pre>
 */
public final class AnalysisResultBuilder {

  private String candidateName = "Jane Doe";
  private double skillMatch = 50;
  private double experience = 50;
  private double toolTech = 50;
  private double seniority = 50;
  private List<String> matchedSkills = List.of("Java");
  private List<String> missingSkills = List.of();
  private String explanation = "Solid match.";

  public AnalysisResultBuilder candidateName(String candidateName) {
    this.candidateName = candidateName;
    return this;
  }

  public AnalysisResultBuilder scores(
      double skillMatch, double experience, double toolTech, double seniority) {
    this.skillMatch = skillMatch;
    this.experience = experience;
    this.toolTech = toolTech;
    this.seniority = seniority;
    return this;
  }

  public AnalysisResultBuilder matchedSkills(String... skills) {
    this.matchedSkills = List.of(skills);
    return this;
  }

  public AnalysisResultBuilder missingSkills(String... skills) {
    this.missingSkills = List.of(skills);
    return this;
  }

  public AnalysisResultBuilder explanation(String explanation) {
    this.explanation = explanation;
    return this;
  }

  public AnalysisResult build() {
    return new AnalysisResult(
        candidateName,
        skillMatch,
        experience,
        toolTech,
        seniority,
        matchedSkills,
        missingSkills,
        explanation);
  }
}
