package com.codeheadsystems.pqsession.server.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Security-relevant events, written to a dedicated logger so they can be routed to an audit sink.
 * Never pass key material or passphrases here.
 */
public final class SecurityEvents {

  public static final String LOGGER_NAME = "com.codeheadsystems.pqsession.security";

  private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

  private SecurityEvents() {
  }

  public static void transcriptIntegrityFailure(String handshakeId, String suite, String reason) {
    log.warn("event=transcript_integrity_failure handshakeId={} suite={} reason={}", handshakeId, suite, reason);
  }

  public static void protocolOrderViolation(String handshakeId, String expected, String actual) {
    log.warn("event=protocol_order_violation handshakeId={} expected={} actual={}", handshakeId, expected, actual);
  }

  public static void keysBackedUp(int keyCount, String custody) {
    log.info("event=key_backup keys={} custody={}", keyCount, custody);
  }

  public static void keysRestored(int keyCount, String custody) {
    log.warn("event=key_restore keys={} custody={}", keyCount, custody);
  }

  public static void restoreRejected(String reason) {
    log.warn("event=key_restore_rejected reason={}", reason);
  }
}
