package dev.talentmatch.ingestion;

/** Session vectors could not be deleted. */
public class VectorStoreException extends RuntimeException {

  public VectorStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
