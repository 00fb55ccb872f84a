package dev.talentmatch.ingestion;

/** A document could not be fully written to the vector store. */
public class IngestionException extends RuntimeException {

  public IngestionException(String message, Throwable cause) {
    super(message, cause);
  }
}
