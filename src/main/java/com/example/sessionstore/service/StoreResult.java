package com.example.sessionstore.service;

import com.example.sessionstore.exception.SessionStoreException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a session store operation. A missing session is {@link NotFound}, never a
 * {@link Failure}; failures carry the client's exception unchanged.
 */
public sealed interface StoreResult<T>
    permits StoreResult.Success, StoreResult.NotFound, StoreResult.Failure {

  record Success<T>(T value) implements StoreResult<T> {}

  record NotFound<T>() implements StoreResult<T> {}

  record Failure<T>(Throwable cause) implements StoreResult<T> {}

  static <T> StoreResult<T> success(T value) {
    return new Success<>(value);
  }

  static StoreResult<Void> ok() {
    return new Success<>(null);
  }

  static <T> StoreResult<T> notFound() {
    return new NotFound<>();
  }

  static <T> StoreResult<T> failure(Throwable cause) {
    return new Failure<>(cause);
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  default boolean isNotFound() {
    return this instanceof NotFound;
  }

  default boolean isFailure() {
    return this instanceof Failure;
  }

  /**
   * @return the value of a success; empty for not-found and for a success without value
   * @throws SessionStoreException if this is a failure
   */
  default Optional<T> toOptional() {
    if (this instanceof Failure<T> failure) {
      throw new SessionStoreException("Session store operation failed", failure.cause());
    }
    if (this instanceof Success<T> success) {
      return Optional.ofNullable(success.value());
    }
    return Optional.empty();
  }

  default <R> StoreResult<R> map(Function<? super T, ? extends R> mapper) {
    if (this instanceof Success<T> success) {
      return new Success<>(mapper.apply(success.value()));
    }
    if (this instanceof Failure<T> failure) {
      return new Failure<>(failure.cause());
    }
    return new NotFound<>();
  }
}
