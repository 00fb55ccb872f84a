package dev.talentmatch.api;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Upload limits bound from {@code talentmatch.upload.*}.
 *
 * @param allowedExtensions accepted file extensions including the dot, compared case-insensitively
 * @param maxFileSize largest accepted CV
 * @param maxFiles largest number of CVs in one ranking request
 */
@ConfigurationProperties(prefix = "talentmatch.upload")
public record UploadProperties(
    @DefaultValue({".pdf", ".doc", ".docx"}) List<String> allowedExtensions,
    @DefaultValue("10MB") DataSize maxFileSize,
    @DefaultValue("50") int maxFiles) {

  public UploadProperties {
    if (allowedExtensions.isEmpty()) {
      throw new IllegalStateException("talentmatch.upload.allowed-extensions must not be empty");
    }
    if (maxFiles < 1) {
      throw new IllegalStateException(
          "talentmatch.upload.max-files must be positive, got: " + maxFiles);
    }
    allowedExtensions = List.copyOf(allowedExtensions);
  }
}
