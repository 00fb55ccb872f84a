package dev.talentmatch.ingestion;

/** Text could not be extracted from an uploaded document. */
public class DocumentExtractionException extends RuntimeException {

  public DocumentExtractionException(String message) {
    super(message);
  }

  public DocumentExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
