package com.codeheadsystems.pqsession.handshake;

import java.util.List;
import java.util.Objects;

/**
 * First handshake message: the client's algorithm offer and nonce.
 *
 * @param offeredKems       KEM names in any order; unknown and null names are ignored
 * @param offeredSignatures signature algorithm names
 * @param clientNonce       32 random bytes
 * @param clientAddress     optional client network address, recorded on the session
 */
public record ClientHello(List<String> offeredKems,
                          List<String> offeredSignatures,
                          byte[] clientNonce,
                          String clientAddress) {

  public static final int NONCE_LENGTH = 32;

  public ClientHello {
    offeredKems = namesOf(offeredKems);
    offeredSignatures = namesOf(offeredSignatures);
  }

  private static List<String> namesOf(List<String> names) {
    if (names == null) {
      return List.of();
    }
    return names.stream().filter(Objects::nonNull).toList();
  }
}
