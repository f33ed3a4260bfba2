package com.codeheadsystems.pqsession.handshake;

import com.codeheadsystems.pqsession.common.ByteUtils;

/**
 * Symmetric keys derived at the end of a handshake.
 *
 * @param clientWriteKey    AES-256 key for client-to-server traffic
 * @param serverWriteKey    AES-256 key for server-to-client traffic
 * @param clientWriteIv     12-byte client IV
 * @param serverWriteIv     12-byte server IV
 * @param clientFinishedKey MAC key for the client's verify data
 * @param serverFinishedKey MAC key for the server's verify data
 */
public record SessionKeys(byte[] clientWriteKey,
                          byte[] serverWriteKey,
                          byte[] clientWriteIv,
                          byte[] serverWriteIv,
                          byte[] clientFinishedKey,
                          byte[] serverFinishedKey) {

  /**
   * Overwrites every key with zeros.
   */
  public void destroy() {
    ByteUtils.zeroize(clientWriteKey, serverWriteKey, clientWriteIv, serverWriteIv,
        clientFinishedKey, serverFinishedKey);
  }

  @Override
  public String toString() {
    return "SessionKeys[<redacted>]";
  }
}
