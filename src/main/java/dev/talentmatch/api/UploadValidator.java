package dev.talentmatch.api;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Checks a ranking request before any session is created: non-blank job description, between one
 * and {@code max-files} CVs, plain and distinct file names, allowed extensions, non-empty files no
 * larger than {@code max-file-size}.
 */
@Component
public class UploadValidator {

  private final UploadProperties properties;

  public UploadValidator(UploadProperties properties) {
    this.properties = properties;
  }

  /**
   * Validates the request.
   *
   * @throws IllegalArgumentException describing the first violation found
   */
  public void validate(@Nullable String jobDescription, @Nullable List<MultipartFile> files) {
    if (jobDescription == null || jobDescription.isBlank()) {
      throw new IllegalArgumentException("Job description must not be blank");
    }
    if (files == null || files.isEmpty()) {
      throw new IllegalArgumentException("At least one CV file is required");
    }
    if (files.size() > properties.maxFiles()) {
      throw new IllegalArgumentException(
          "Too many files: " + files.size() + " (maximum " + properties.maxFiles() + ")");
    }
    Set<String> seen = new HashSet<>();
    for (MultipartFile file : files) {
      String filename = validateFilename(file.getOriginalFilename());
      if (!seen.add(filename)) {
        throw new IllegalArgumentException("Duplicate file name: " + filename);
      }
      if (file.isEmpty()) {
        throw new IllegalArgumentException("File is empty: " + filename);
      }
      if (file.getSize() > properties.maxFileSize().toBytes()) {
        throw new IllegalArgumentException(
            "File " + filename + " exceeds the maximum size of " + properties.maxFileSize());
      }
    }
  }

  String validateFilename(@Nullable String filename) {
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("File name is required");
    }
    if (filename.contains("/") || filename.contains("\\") || filename.startsWith(".")) {
      throw new IllegalArgumentException("Invalid file name: " + filename);
    }
    String lower = filename.toLowerCase(Locale.ROOT);
    boolean allowed =
        properties.allowedExtensions().stream()
            .anyMatch(extension -> lower.endsWith(extension.toLowerCase(Locale.ROOT)));
    if (!allowed) {
      throw new IllegalArgumentException(
          "Unsupported file type: " + filename + " (allowed: "
              + String.join(", ", properties.allowedExtensions()) + ")");
    }
    return filename;
  }
}
