package com.codeheadsystems.pqsession.crypto;

import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.Outcome;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the strongest mutually supported algorithm suite from a client's offer.
 *
 * <p>Offered names the server does not recognise are ignored. Among the recognised names that the
 * server supports, the highest {@link NegotiableAlgorithm#rank()} wins; ties go to the lower
 * {@link NegotiableAlgorithm#preference()}. The result is deterministic for a given offer and
 * supported set, and the order of the client's offer does not influence it.
 */
public class AlgorithmNegotiator {

  private static final Logger log = LoggerFactory.getLogger(AlgorithmNegotiator.class);

  private final Set<KemAlgorithm> supportedKems;
  private final Set<SignatureAlgorithm> supportedSignatures;

  /**
   * Creates a negotiator over the given server capabilities.
   *
   * @param supportedKems       KEMs the server will accept
   * @param supportedSignatures signature algorithms the server can sign with
   */
  public AlgorithmNegotiator(Set<KemAlgorithm> supportedKems, Set<SignatureAlgorithm> supportedSignatures) {
    this.supportedKems = supportedKems.isEmpty()
        ? EnumSet.noneOf(KemAlgorithm.class) : EnumSet.copyOf(supportedKems);
    this.supportedSignatures = supportedSignatures.isEmpty()
        ? EnumSet.noneOf(SignatureAlgorithm.class) : EnumSet.copyOf(supportedSignatures);
  }

  /**
   * Picks the strongest algorithm from {@code offered} that appears in {@code supported}.
   *
   * @param offered   the client's offered names
   * @param supported the server's supported algorithms
   * @param resolver  maps a wire name to an algorithm
   * @param <A>       the algorithm type
   * @return the selected algorithm, or empty if there is no overlap
   */
  public static <A extends NegotiableAlgorithm> Optional<A> selectStrongest(Collection<String> offered,
                                                                            Collection<A> supported,
                                                                            Function<String, Optional<A>> resolver) {
    if (offered == null) {
      return Optional.empty();
    }
    return offered.stream()
        .map(resolver)
        .flatMap(Optional::stream)
        .filter(supported::contains)
        .distinct()
        .max(Comparator.<A>comparingInt(NegotiableAlgorithm::rank)
            .thenComparing(Comparator.<A>comparingInt(NegotiableAlgorithm::preference).reversed()));
  }

  /**
   * Negotiates a suite.
   *
   * @param offeredKems       KEM names offered by the client
   * @param offeredSignatures signature names offered by the client
   * @return the suite, or {@link ErrorKind#ALGORITHM_NEGOTIATION_FAILED}
   */
  public Outcome<AlgorithmSuite> negotiate(Collection<String> offeredKems, Collection<String> offeredSignatures) {
    Optional<KemAlgorithm> kem = selectStrongest(offeredKems, supportedKems, KemAlgorithm::fromName);
    if (kem.isEmpty()) {
      log.debug("No common KEM: offered={} supported={}", offeredKems, supportedKems);
      return Outcome.failure(ErrorKind.ALGORITHM_NEGOTIATION_FAILED,
          "No mutually supported KEM algorithm among " + offeredKems);
    }
    Optional<SignatureAlgorithm> sig = selectStrongest(offeredSignatures, supportedSignatures,
        SignatureAlgorithm::fromName);
    if (sig.isEmpty()) {
      log.debug("No common signature: offered={} supported={}", offeredSignatures, supportedSignatures);
      return Outcome.failure(ErrorKind.ALGORITHM_NEGOTIATION_FAILED,
          "No mutually supported signature algorithm among " + offeredSignatures);
    }
    return Outcome.success(new AlgorithmSuite(kem.get(), sig.get()));
  }

  /**
   * Returns a negotiator whose signature choices are narrowed to {@code allowed}.
   *
   * @param allowed signature algorithms to keep
   * @return a new negotiator
   */
  public AlgorithmNegotiator restrictSignatures(Set<SignatureAlgorithm> allowed) {
    EnumSet<SignatureAlgorithm> narrowed = EnumSet.noneOf(SignatureAlgorithm.class);
    for (SignatureAlgorithm alg : supportedSignatures) {
      if (allowed.contains(alg)) {
        narrowed.add(alg);
      }
    }
    return new AlgorithmNegotiator(supportedKems, narrowed);
  }

  public Set<KemAlgorithm> supportedKems() {
    return Set.copyOf(supportedKems);
  }

  public Set<SignatureAlgorithm> supportedSignatures() {
    return Set.copyOf(supportedSignatures);
  }

  /**
   * Canonical names of the supported KEMs, strongest first.
   *
   * @return the names
   */
  public List<String> supportedKemNames() {
    return supportedKems.stream()
        .sorted(Comparator.comparingInt(KemAlgorithm::rank).reversed())
        .map(KemAlgorithm::id)
        .toList();
  }
}
