package com.codeheadsystems.pqsession.crypto;

/**
 * Key derivation and MAC primitives used by the session key schedule.
 */
public interface KeyDerivation {

  /**
   * Output length of the underlying hash, in bytes.
   *
   * @return the length
   */
  int hashLength();

  byte[] extract(byte[] salt, byte[] ikm);

  /**
   * HKDF-Expand with a labelled info structure:
   * {@code I2OSP(length, 2) || vec1("pqsession " + label) || vec1(context)}.
   *
   * @param prk     pseudorandom key from {@link #extract}
   * @param label   the label
   * @param context the context, usually a transcript hash
   * @param length  output length
   * @return the derived bytes
   */
  byte[] expandLabel(byte[] prk, String label, byte[] context, int length);

  byte[] mac(byte[] key, byte[] data);

  byte[] hash(byte[] data);
}
