package dev.talentmatch.matching;

import dev.talentmatch.ingestion.VectorStoreException;
import dev.talentmatch.session.SessionId;
import dev.talentmatch.session.SessionManager;
import dev.talentmatch.session.SessionStorageException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes sessions that outlived {@code talentmatch.session.max-age}.
 *
 * <p>Each expired session goes through {@link MatchingService#cleanup(SessionId)}: vectors first,
 * then files. A session whose vectors could not be deleted keeps its directory and is retried on
 * the next run.
 */
@Component
public class SessionSweeper {

  private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

  private final SessionManager sessionManager;
  private final MatchingService matchingService;

  public SessionSweeper(SessionManager sessionManager, MatchingService matchingService) {
    this.sessionManager = sessionManager;
    this.matchingService = matchingService;
  }

  @Scheduled(
      initialDelayString = "${talentmatch.session.sweep-interval:PT1H}",
      fixedDelayString = "${talentmatch.session.sweep-interval:PT1H}")
  public void sweep() {
    List<SessionId> expired = sessionManager.findExpired();
    int swept = 0;
    for (SessionId sessionId : expired) {
      try {
        matchingService.cleanup(sessionId);
        swept++;
      } catch (VectorStoreException | SessionStorageException e) {
        log.warn("Expired session {} not swept, retrying next run: {}", sessionId, e.getMessage());
      }
    }
    if (swept > 0) {
      log.info("Swept {} of {} expired sessions", swept, expired.size());
    }
  }
}
