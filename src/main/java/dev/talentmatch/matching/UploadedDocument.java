package dev.talentmatch.matching;

import java.util.Objects;

/**
 * A CV file received with a ranking request.
 *
 * @param filename original file name, already validated as a plain name
 * @param content file bytes
 */
public record UploadedDocument(String filename, byte[] content) {

  public UploadedDocument {
    Objects.requireNonNull(filename, "filename must not be null");
    Objects.requireNonNull(content, "content must not be null");
  }
}
