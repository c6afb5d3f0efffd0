package com.example.sessionstore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.sessionstore.exception.SessionStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StoreResult Tests")
class StoreResultTest {

  @Test
  @DisplayName("not-found is neither success nor failure")
  void notFound() {
    StoreResult<String> result = StoreResult.notFound();

    assertThat(result.isNotFound()).isTrue();
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.isFailure()).isFalse();
    assertThat(result.toOptional()).isEmpty();
  }

  @Test
  @DisplayName("map transforms successes and passes the other outcomes through")
  void map() {
    IllegalStateException cause = new IllegalStateException("boom");

    assertThat(StoreResult.success("abc").map(String::length)).isEqualTo(StoreResult.success(3));
    assertThat(StoreResult.<String>notFound().map(String::length).isNotFound()).isTrue();
    assertThat(StoreResult.<String>failure(cause).map(String::length)).isEqualTo(StoreResult.failure(cause));
  }

  @Test
  @DisplayName("toOptional turns a failure into a SessionStoreException with the original cause")
  void failureThrowsOnUnwrap() {
    IllegalStateException cause = new IllegalStateException("boom");

    assertThatThrownBy(() -> StoreResult.failure(cause).toOptional())
        .isInstanceOf(SessionStoreException.class)
        .hasCause(cause);
  }
}
