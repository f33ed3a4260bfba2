package com.codeheadsystems.pqsession.server.key;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Current and immediately preceding key of one {@link KeyType}.
 * <p>
 * Not thread-safe; {@link DefaultKeyManager} guards every ring with its read/write lock.
 * Methods that drop a key return it so the caller can discard it outside the lock.
 */
final class KeyRing {

  private final KeyType type;
  private ManagedKeyPair current;
  private ManagedKeyPair previous;
  private Instant previousRetiredAt;
  private int lastVersion;

  KeyRing(KeyType type) {
    this.type = type;
  }

  KeyType type() {
    return type;
  }

  Optional<ManagedKeyPair> current() {
    return Optional.ofNullable(current);
  }

  int lastVersion() {
    return lastVersion;
  }

  int nextVersion() {
    return lastVersion + 1;
  }

  /**
   * Makes {@code next} current. The old current becomes the in-grace previous key.
   *
   * @param next the new key
   * @param now  retirement time for the old current key
   * @return keys dropped entirely, i.e. the old previous key
   */
  List<ManagedKeyPair> install(ManagedKeyPair next, Instant now) {
    List<ManagedKeyPair> dropped = new ArrayList<>(1);
    if (previous != null) {
      dropped.add(previous);
    }
    previous = current;
    previousRetiredAt = current == null ? null : now;
    current = next;
    lastVersion = Math.max(lastVersion, next.version());
    return dropped;
  }

  /**
   * Finds a key that is valid at {@code now}: the current key, or the previous key while
   * {@code now <= retiredAt + grace}.
   */
  Optional<ManagedKeyPair> find(int version, Instant now, Duration grace) {
    if (current != null && current.version() == version) {
      return Optional.of(current);
    }
    if (previous != null && previous.version() == version && inGrace(now, grace)) {
      return Optional.of(previous);
    }
    return Optional.empty();
  }

  /**
   * Previous key if still inside its grace period.
   */
  Optional<ManagedKeyPair> retiring(Instant now, Duration grace) {
    return previous != null && inGrace(now, grace) ? Optional.of(previous) : Optional.empty();
  }

  Optional<Instant> retiringValidUntil(Duration grace) {
    return Optional.ofNullable(previousRetiredAt).map(t -> t.plus(grace));
  }

  Optional<Instant> previousRetiredAt() {
    return Optional.ofNullable(previousRetiredAt);
  }

  /**
   * Drops the previous key once its grace period has elapsed.
   *
   * @return the dropped key, if any
   */
  Optional<ManagedKeyPair> purge(Instant now, Duration grace) {
    if (previous == null || inGrace(now, grace)) {
      return Optional.empty();
    }
    ManagedKeyPair dropped = previous;
    previous = null;
    previousRetiredAt = null;
    return Optional.of(dropped);
  }

  /**
   * Replaces the whole ring, used by restore.
   *
   * @return every key that was held before
   */
  List<ManagedKeyPair> replace(ManagedKeyPair newCurrent, ManagedKeyPair newPrevious,
                               Instant newPreviousRetiredAt, int restoredLastVersion) {
    List<ManagedKeyPair> dropped = new ArrayList<>(2);
    if (current != null) {
      dropped.add(current);
    }
    if (previous != null) {
      dropped.add(previous);
    }
    current = newCurrent;
    previous = newPrevious;
    previousRetiredAt = newPrevious == null ? null : newPreviousRetiredAt;
    lastVersion = Math.max(lastVersion, restoredLastVersion);
    return dropped;
  }

  private boolean inGrace(Instant now, Duration grace) {
    return previousRetiredAt != null && !now.isAfter(previousRetiredAt.plus(grace));
  }
}
