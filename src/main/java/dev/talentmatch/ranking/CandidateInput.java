package dev.talentmatch.ranking;

import java.util.Objects;

/**
 * One candidate handed to the ranking engine.
 *
 * @param id identity key, also the key of the candidate's semantic score
 * @param displayName name derived during ingestion, used when the assessment reports none
 * @param sourcePath stored upload path
 * @param text extracted CV text
 */
public record CandidateInput(String id, String displayName, String sourcePath, String text) {

  public CandidateInput {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(displayName, "displayName must not be null");
    Objects.requireNonNull(sourcePath, "sourcePath must not be null");
    Objects.requireNonNull(text, "text must not be null");
  }
}
