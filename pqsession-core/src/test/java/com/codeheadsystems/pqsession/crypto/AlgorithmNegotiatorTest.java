package com.codeheadsystems.pqsession.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.Outcome;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AlgorithmNegotiatorTest {

  private static final Set<SignatureAlgorithm> ALL_SIGS = EnumSet.allOf(SignatureAlgorithm.class);

  @Test
  void selectsStrongestCommonKem() {
    // Client offers {512, 1024}; server supports {1024, 768}.
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(
        EnumSet.of(KemAlgorithm.ML_KEM_1024, KemAlgorithm.ML_KEM_768), ALL_SIGS);

    Outcome<AlgorithmSuite> outcome = negotiator.negotiate(
        List.of("ML-KEM-512", "ML-KEM-1024"), List.of("ML-DSA-65"));

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value().kem()).isEqualTo(KemAlgorithm.ML_KEM_1024);
    assertThat(outcome.value().signature()).isEqualTo(SignatureAlgorithm.ML_DSA_65);
  }

  @Test
  void noOverlapFails() {
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(EnumSet.of(KemAlgorithm.ML_KEM_1024), ALL_SIGS);

    Outcome<AlgorithmSuite> outcome = negotiator.negotiate(List.of("ML-KEM-512"), List.of("ML-DSA-65"));

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.error()).isEqualTo(ErrorKind.ALGORITHM_NEGOTIATION_FAILED);
  }

  @Test
  void offerOrderDoesNotMatter() {
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(EnumSet.allOf(KemAlgorithm.class), ALL_SIGS);

    AlgorithmSuite a = negotiator.negotiate(
        List.of("ML-KEM-512", "ML-KEM-768"), List.of("ML-DSA-44", "ML-DSA-87")).orElseThrow();
    AlgorithmSuite b = negotiator.negotiate(
        List.of("ML-KEM-768", "ML-KEM-512"), List.of("ML-DSA-87", "ML-DSA-44")).orElseThrow();

    assertThat(a).isEqualTo(b);
    assertThat(a.suiteName()).isEqualTo("ML-KEM-768+ML-DSA-87");
  }

  @Test
  void unknownAndLegacyNamesAreHandled() {
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(EnumSet.allOf(KemAlgorithm.class), ALL_SIGS);

    AlgorithmSuite suite = negotiator.negotiate(
        List.of("X25519", "kyber768"), List.of("Dilithium2", "RSA")).orElseThrow();

    assertThat(suite.kem()).isEqualTo(KemAlgorithm.ML_KEM_768);
    assertThat(suite.signature()).isEqualTo(SignatureAlgorithm.ML_DSA_44);
  }

  @Test
  void emptyOfferFails() {
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(EnumSet.allOf(KemAlgorithm.class), ALL_SIGS);

    assertThat(negotiator.negotiate(List.of(), List.of("ML-DSA-65")).error())
        .isEqualTo(ErrorKind.ALGORITHM_NEGOTIATION_FAILED);
    assertThat(negotiator.negotiate(List.of("ML-KEM-768"), null).error())
        .isEqualTo(ErrorKind.ALGORITHM_NEGOTIATION_FAILED);
  }

  @Test
  void restrictSignatures_narrowsChoices() {
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(EnumSet.allOf(KemAlgorithm.class), ALL_SIGS)
        .restrictSignatures(Set.of(SignatureAlgorithm.ML_DSA_65));

    assertThat(negotiator.negotiate(List.of("ML-KEM-768"), List.of("ML-DSA-87")).error())
        .isEqualTo(ErrorKind.ALGORITHM_NEGOTIATION_FAILED);
    assertThat(negotiator.negotiate(List.of("ML-KEM-768"), List.of("ML-DSA-87", "ML-DSA-65"))
        .orElseThrow().signature()).isEqualTo(SignatureAlgorithm.ML_DSA_65);
  }

  @Test
  void supportedKemNames_strongestFirst() {
    AlgorithmNegotiator negotiator = new AlgorithmNegotiator(EnumSet.allOf(KemAlgorithm.class), ALL_SIGS);
    assertThat(negotiator.supportedKemNames()).containsExactly("ML-KEM-1024", "ML-KEM-768", "ML-KEM-512");
  }
}
