package dev.talentmatch.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Requirements extracted from a job description.
 *
 * @param requiredSkills skills the role asks for
 * @param requiredTools tools and technologies the role asks for
 * @param requiredExperienceYears years of experience asked for, 0 when unstated
 * @param seniorityLevel junior, mid, senior, lead, or {@value #UNKNOWN_SENIORITY}
 * @param keyResponsibilities main responsibilities of the role
 */
public record JobRequirements(
    List<String> requiredSkills,
    List<String> requiredTools,
    double requiredExperienceYears,
    String seniorityLevel,
    List<String> keyResponsibilities) {

  public static final String UNKNOWN_SENIORITY = "unknown";

  public JobRequirements {
    Objects.requireNonNull(seniorityLevel, "seniorityLevel must not be null");
    requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
    requiredTools = requiredTools == null ? List.of() : List.copyOf(requiredTools);
    keyResponsibilities = keyResponsibilities == null ? List.of() : List.copyOf(keyResponsibilities);
    if (Double.isNaN(requiredExperienceYears) || requiredExperienceYears < 0) {
      requiredExperienceYears = 0;
    }
  }

  /** Degraded result used when extraction fails. */
  public static JobRequirements empty() {
    return new JobRequirements(List.of(), List.of(), 0, UNKNOWN_SENIORITY, List.of());
  }
}
