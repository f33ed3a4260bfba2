package com.codeheadsystems.pqsession.server.key;

/**
 * The two kinds of long-lived key the server holds.
 */
public enum KeyType {
  KEM("kem"),
  SIGNATURE("sig");

  private final String idPrefix;

  KeyType(String idPrefix) {
    this.idPrefix = idPrefix;
  }

  public String idPrefix() {
    return idPrefix;
  }
}
