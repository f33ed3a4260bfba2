package com.codeheadsystems.pqsession.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of {@link SessionStore#verify}.
 *
 * @param sessionId the queried id
 * @param valid     true only for an active, unexpired session
 * @param reason    the distinguishing reason
 * @param record    the stored record when one exists
 */
public record SessionVerification(String sessionId,
                                  boolean valid,
                                  VerificationReason reason,
                                  Optional<SessionRecord> record) {

  /**
   * Classifies a lookup result.
   *
   * @param sessionId the queried id
   * @param record    the stored record, or null if absent
   * @param now       the current time
   * @return the verification
   */
  public static SessionVerification of(String sessionId, SessionRecord record, Instant now) {
    if (record == null) {
      return new SessionVerification(sessionId, false, VerificationReason.NOT_FOUND, Optional.empty());
    }
    VerificationReason reason = switch (record.effectiveState(now)) {
      case ACTIVE -> VerificationReason.VALID;
      case EXPIRED -> VerificationReason.EXPIRED;
      case INVALIDATED -> VerificationReason.INVALIDATED;
    };
    return new SessionVerification(sessionId, reason == VerificationReason.VALID, reason, Optional.of(record));
  }
}
