package dev.talentmatch.scoring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Semantic scoring settings bound from {@code talentmatch.semantic.*}.
 *
 * @param maxChars documents are truncated to this many characters before being embedded
 */
@ConfigurationProperties(prefix = "talentmatch.semantic")
public record SemanticProperties(@DefaultValue("8000") int maxChars) {

  public SemanticProperties {
    if (maxChars < 1) {
      throw new IllegalStateException(
          "talentmatch.semantic.max-chars must be positive, got: " + maxChars);
    }
  }
}
