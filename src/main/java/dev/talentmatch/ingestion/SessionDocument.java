package dev.talentmatch.ingestion;

import dev.talentmatch.session.SessionId;
import java.nio.file.Path;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A document extracted for one ranking session.
 *
 * @param role job description or CV
 * @param sessionId owning session
 * @param documentKey stable key of the document within its session ({@code "job"} for the job
 *     description, the uploaded file name for a CV)
 * @param text extracted plain text
 * @param sourcePath stored upload; null for the job description
 * @param candidateName display name derived from file name or text; null for the job description
 */
public record SessionDocument(
    DocumentRole role,
    SessionId sessionId,
    String documentKey,
    String text,
    @Nullable Path sourcePath,
    @Nullable String candidateName) {

  static final String JOB_DOCUMENT_KEY = "job";

  public SessionDocument {
    Objects.requireNonNull(role, "role must not be null");
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    Objects.requireNonNull(documentKey, "documentKey must not be null");
    Objects.requireNonNull(text, "text must not be null");
    if (documentKey.isBlank()) {
      throw new IllegalArgumentException("documentKey must not be blank");
    }
  }

  public static SessionDocument jobDescription(SessionId sessionId, String text) {
    return new SessionDocument(
        DocumentRole.JOB_DESCRIPTION, sessionId, JOB_DOCUMENT_KEY, text, null, null);
  }

  public static SessionDocument cv(
      SessionId sessionId, String fileName, String text, Path sourcePath, String candidateName) {
    return new SessionDocument(DocumentRole.CV, sessionId, fileName, text, sourcePath, candidateName);
  }
}
