package com.example.sessionstore.adapter.redis.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisTemplateSessionClient Tests")
class RedisTemplateSessionClientTest {

  @Mock private RedisOperations<String, String> operations;
  @Mock private ValueOperations<String, String> valueOperations;
  @Mock private Cursor<String> cursor;

  private RedisTemplateSessionClient client;

  @BeforeEach
  void setUp() {
    client = new RedisTemplateSessionClient(operations);
  }

  @Test
  @DisplayName("set with a positive TTL uses the timed SET")
  void setWithTtl() {
    when(operations.opsForValue()).thenReturn(valueOperations);

    client.set("k", "v", 60L);

    verify(valueOperations).set("k", "v", Duration.ofSeconds(60));
    verify(valueOperations, never()).set("k", "v");
  }

  @Test
  @DisplayName("set without TTL stores the key without expiry")
  void setWithoutTtl() {
    when(operations.opsForValue()).thenReturn(valueOperations);

    client.set("k", "v");

    verify(valueOperations).set("k", "v");
  }

  @Test
  @DisplayName("expire maps a null reply to false")
  void expire() {
    when(operations.expire("k", Duration.ofSeconds(30))).thenReturn(true);
    when(operations.expire("gone", Duration.ofSeconds(30))).thenReturn(null);

    assertThat(client.expire("k", 30)).isTrue();
    assertThat(client.expire("gone", 30)).isFalse();
  }

  @Test
  @DisplayName("multiGet keeps null entries in place")
  void multiGet() {
    when(operations.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.multiGet(List.of("a", "b"))).thenReturn(Arrays.asList(null, "2"));

    assertThat(client.multiGet(List.of("a", "b"))).containsExactly(null, "2");
  }

  @Test
  @DisplayName("deleteMany returns the removed count and skips empty lists")
  void deleteMany() {
    when(operations.delete(List.of("a", "b"))).thenReturn(2L);

    assertThat(client.deleteMany(List.of("a", "b"))).isEqualTo(2L);
    assertThat(client.deleteMany(List.of())).isZero();
  }

  @Test
  @DisplayName("empty multiGet never reaches the server")
  void emptyMultiGet() {
    assertThat(client.multiGet(List.of())).isEmpty();

    verifyNoInteractions(operations);
  }

  @Test
  @DisplayName("scan passes pattern and batch size to the server-side cursor")
  void scan() {
    when(operations.scan(any(ScanOptions.class))).thenReturn(cursor);
    when(cursor.stream()).thenReturn(Stream.of("sess:a", "sess:b"));

    List<String> keys = client.scan("sess:*", 25).collect(Collectors.toList());

    ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
    verify(operations).scan(options.capture());
    assertThat(options.getValue().getPattern()).isEqualTo("sess:*");
    assertThat(options.getValue().getCount()).isEqualTo(25L);
    assertThat(keys).containsExactly("sess:a", "sess:b");
  }
}
