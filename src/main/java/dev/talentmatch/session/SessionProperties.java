package dev.talentmatch.session;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Session storage settings bound from {@code talentmatch.session.*}.
 *
 * @param baseDir directory holding one sub-directory per live session
 * @param maxAge sessions whose directory was last modified longer ago than this are swept
 * @param sweepInterval delay between two sweeps
 */
@ConfigurationProperties(prefix = "talentmatch.session")
public record SessionProperties(
    @DefaultValue("temp_sessions") Path baseDir,
    @DefaultValue("PT24H") Duration maxAge,
    @DefaultValue("PT1H") Duration sweepInterval) {

  public SessionProperties {
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalStateException("talentmatch.session.max-age must be positive, got: " + maxAge);
    }
    if (sweepInterval.isNegative() || sweepInterval.isZero()) {
      throw new IllegalStateException(
          "talentmatch.session.sweep-interval must be positive, got: " + sweepInterval);
    }
  }
}
