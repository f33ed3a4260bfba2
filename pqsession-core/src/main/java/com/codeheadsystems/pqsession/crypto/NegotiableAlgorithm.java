package com.codeheadsystems.pqsession.crypto;

/**
 * An algorithm that can be offered by a client and selected by the server.
 */
public interface NegotiableAlgorithm {

  /**
   * Canonical wire name, e.g. {@code ML-KEM-768}.
   *
   * @return the id
   */
  String id();

  /**
   * Security-level rank. Higher ranks win negotiation.
   *
   * @return the rank
   */
  int rank();

  /**
   * Fixed preference used to break ties between algorithms of equal rank. Lower is preferred.
   *
   * @return the preference
   */
  int preference();
}
