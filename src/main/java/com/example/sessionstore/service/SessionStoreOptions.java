package com.example.sessionstore.service;

import com.example.sessionstore.domain.entity.SessionData;
import com.example.sessionstore.service.codec.SessionSerializer;
import java.time.Clock;
import java.util.function.ToLongFunction;
import lombok.Builder;

/**
 * Construction options for {@link RedisSessionStore}. Unset values fall back to defaults.
 *
 * @param client a Lettuce connection or commands, a Spring {@code RedisOperations<String, String>},
 *     or a {@code SessionKeyValueClient}; required
 * @param prefix key prefix, default {@code sess:}
 * @param scanBatchSize SCAN COUNT hint, default 100
 * @param serializer record codec, default JSON
 * @param ttlSeconds static TTL, default one day
 * @param ttlFunction per-record TTL; takes precedence over every other TTL source
 * @param disableTtl write keys without expiry and make touch a no-op
 * @param disableTouch make touch a no-op while save still sets TTL
 * @param clock time source for cookie-expiry TTL
 */
@Builder
public record SessionStoreOptions(
    Object client,
    String prefix,
    Integer scanBatchSize,
    SessionSerializer serializer,
    Long ttlSeconds,
    ToLongFunction<SessionData> ttlFunction,
    boolean disableTtl,
    boolean disableTouch,
    Clock clock
) {}
