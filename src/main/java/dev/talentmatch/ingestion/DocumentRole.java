package dev.talentmatch.ingestion;

import com.fasterxml.jackson.annotation.JsonValue;

/** Role a document plays in a ranking session. */
public enum DocumentRole {
  JOB_DESCRIPTION("job_description", "jd"),
  CV("cv", "cv");

  private final String value;
  private final String keyPrefix;

  DocumentRole(String value, String keyPrefix) {
    this.value = value;
    this.keyPrefix = keyPrefix;
  }

  /** Lowercase value stored in vector metadata. */
  @JsonValue
  public String value() {
    return value;
  }

  /** Prefix used at the start of chunk identity keys. */
  public String keyPrefix() {
    return keyPrefix;
  }
}
