package dev.talentmatch.session;

/**
 * Thrown when work is attempted against a session that was cleaned up or never created. Once a
 * session is torn down every further write or read against it fails closed with this exception.
 */
public class SessionClosedException extends RuntimeException {

  private final SessionId sessionId;

  public SessionClosedException(SessionId sessionId) {
    super("Session " + sessionId + " is closed or unknown");
    this.sessionId = sessionId;
  }

  public SessionId getSessionId() {
    return sessionId;
  }
}
