package dev.talentmatch.config;

import dev.talentmatch.ingestion.DocumentExtractionException;
import dev.talentmatch.ingestion.IngestionException;
import dev.talentmatch.ingestion.VectorStoreException;
import dev.talentmatch.session.SessionClosedException;
import dev.talentmatch.session.SessionFileNotFoundException;
import dev.talentmatch.session.SessionStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Input faults map to 4xx with the exception message as detail. Resource faults (storage,
 * vector store, ingestion) map to 500 with a generic detail; the cause is logged here.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  ProblemDetail handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.PAYLOAD_TOO_LARGE, "Upload exceeds the maximum allowed size");
  }

  @ExceptionHandler(SessionFileNotFoundException.class)
  ProblemDetail handleFileNotFound(SessionFileNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(SessionClosedException.class)
  ProblemDetail handleSessionClosed(SessionClosedException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(DocumentExtractionException.class)
  ProblemDetail handleExtraction(DocumentExtractionException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
  }

  /** Storage, vector store and ingestion faults; the detail does not leak internals. */
  @ExceptionHandler({
    SessionStorageException.class,
    VectorStoreException.class,
    IngestionException.class
  })
  ProblemDetail handleResourceFault(RuntimeException ex) {
    log.error("Request failed with resource fault", ex);
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.INTERNAL_SERVER_ERROR, "The ranking could not be completed, please try again");
  }
}
