package dev.talentmatch.session;

/** A requested file does not exist in the session's storage. */
public class SessionFileNotFoundException extends RuntimeException {

  public SessionFileNotFoundException(SessionId sessionId, String filename) {
    super("File " + filename + " not found in session " + sessionId);
  }
}
