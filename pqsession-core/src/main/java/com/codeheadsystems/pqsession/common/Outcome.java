package com.codeheadsystems.pqsession.common;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an operation that either produced a value or failed with a classified error.
 * Exactly one of {@code value} and {@code error} is non-null.
 *
 * @param <T>     the value type
 * @param value   the value on success
 * @param error   the error kind on failure
 * @param message human readable detail on failure
 */
public record Outcome<T>(T value, ErrorKind error, String message) {

  public Outcome {
    if ((value == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of value or error must be set");
    }
  }

  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> Outcome<T> failure(ErrorKind error, String message) {
    return new Outcome<>(null, Objects.requireNonNull(error, "error"), message);
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * Returns the value or throws if this outcome is a failure.
   *
   * @return the value
   * @throws IllegalStateException if this is a failure
   */
  public T orElseThrow() {
    if (error != null) {
      throw new IllegalStateException(error + ": " + message);
    }
    return value;
  }

  public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
    return isSuccess() ? success(mapper.apply(value)) : failure(error, message);
  }
}
