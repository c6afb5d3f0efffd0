package com.example.sessionstore.adapter.redis.client;

import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.sync.RedisCommands;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Session client over Lettuce's native synchronous API: keyword-style SET options and
 * a cursor object for SCAN.
 */
@Slf4j
@RequiredArgsConstructor
public class LettuceSessionClient implements SessionKeyValueClient {

  private final RedisCommands<String, String> commands;

  @Override
  public String get(String key) {
    return commands.get(key);
  }

  @Override
  public void set(String key, String value, Long ttlSeconds) {
    if (ttlSeconds != null && ttlSeconds > 0) {
      commands.set(key, value, SetArgs.Builder.ex(ttlSeconds));
    } else {
      commands.set(key, value);
    }
  }

  @Override
  public boolean expire(String key, long ttlSeconds) {
    return Boolean.TRUE.equals(commands.expire(key, ttlSeconds));
  }

  @Override
  public List<String> multiGet(List<String> keys) {
    if (keys.isEmpty()) {
      return Collections.emptyList();
    }
    return commands.mget(keys.toArray(new String[0])).stream()
        .map(kv -> kv.getValueOrElse(null))
        .collect(Collectors.toList());
  }

  @Override
  public long deleteMany(List<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    Long removed = commands.del(keys.toArray(new String[0]));
    return removed != null ? removed : 0;
  }

  @Override
  public Stream<String> scan(String matchPattern, int batchSize) {
    ScanArgs args = ScanArgs.Builder.matches(matchPattern).limit(batchSize);
    Iterator<String> keys = new CursorIterator(args);
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(keys, Spliterator.ORDERED), false);
  }

  /**
   * Pulls one SCAN batch at a time until the server reports the cursor finished.
   */
  private final class CursorIterator implements Iterator<String> {

    private final ScanArgs args;
    private KeyScanCursor<String> cursor;
    private Iterator<String> batch = Collections.emptyIterator();

    private CursorIterator(ScanArgs args) {
      this.args = args;
    }

    @Override
    public boolean hasNext() {
      while (!batch.hasNext() && moreRemains()) {
        cursor = commands.scan(cursor == null ? ScanCursor.INITIAL : cursor, args);
        batch = cursor.getKeys().iterator();
        log.trace("SCAN batch returned {} keys, cursor {}", cursor.getKeys().size(), cursor.getCursor());
      }
      return batch.hasNext();
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return batch.next();
    }

    private boolean moreRemains() {
      return cursor == null || !cursor.isFinished();
    }
  }
}
