package dev.talentmatch.analysis;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Structured-assessment settings bound from {@code talentmatch.analysis.*}.
 *
 * @param apiKey OpenAI API key; required only when the OpenAI chat model bean is created
 * @param modelName chat model name
 * @param timeout upper bound for one candidate analysis, applied both to the HTTP call and to the
 *     ranking fan-out
 * @param maxInputChars job description and CV are truncated to this many characters
 * @param requirementsMaxInputChars truncation budget for requirement extraction
 * @param concurrency number of candidates analysed in parallel
 */
@ConfigurationProperties(prefix = "talentmatch.analysis")
public record AnalysisProperties(
    @Nullable String apiKey,
    @DefaultValue("gpt-4.1") String modelName,
    @DefaultValue("PT90S") Duration timeout,
    @DefaultValue("15000") int maxInputChars,
    @DefaultValue("10000") int requirementsMaxInputChars,
    @DefaultValue("4") int concurrency) {

  public AnalysisProperties {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "talentmatch.analysis.timeout must be positive, got: " + timeout);
    }
    if (maxInputChars < 1 || requirementsMaxInputChars < 1) {
      throw new IllegalStateException("talentmatch.analysis input budgets must be positive");
    }
    if (concurrency < 1 || concurrency > 64) {
      throw new IllegalStateException(
          "talentmatch.analysis.concurrency must be in [1, 64], got: " + concurrency);
    }
  }
}
