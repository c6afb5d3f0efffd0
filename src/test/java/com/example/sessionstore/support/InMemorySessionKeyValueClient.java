package com.example.sessionstore.support;

import com.example.sessionstore.adapter.redis.client.SessionKeyValueClient;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Map-backed client for store tests. Records TTLs instead of expiring keys and can be told
 * to fail writes to particular keys.
 */
public class InMemorySessionKeyValueClient implements SessionKeyValueClient {

  private final Map<String, String> values = new TreeMap<>();
  private final Map<String, Long> ttls = new TreeMap<>();
  private final Set<String> failingWrites = new HashSet<>();
  private int expireCalls;
  private final List<Integer> scanBatchSizes = new ArrayList<>();

  @Override
  public String get(String key) {
    return values.get(key);
  }

  @Override
  public void set(String key, String value, Long ttlSeconds) {
    if (failingWrites.contains(key)) {
      throw new IllegalStateException("write refused for " + key);
    }
    values.put(key, value);
    if (ttlSeconds != null && ttlSeconds > 0) {
      ttls.put(key, ttlSeconds);
    } else {
      ttls.remove(key);
    }
  }

  @Override
  public boolean expire(String key, long ttlSeconds) {
    expireCalls++;
    if (!values.containsKey(key)) {
      return false;
    }
    ttls.put(key, ttlSeconds);
    return true;
  }

  @Override
  public List<String> multiGet(List<String> keys) {
    return keys.stream().map(values::get).collect(Collectors.toList());
  }

  @Override
  public long deleteMany(List<String> keys) {
    long removed = 0;
    for (String key : new HashSet<>(keys)) {
      if (values.remove(key) != null) {
        removed++;
      }
      ttls.remove(key);
    }
    return removed;
  }

  @Override
  public Stream<String> scan(String matchPattern, int batchSize) {
    scanBatchSizes.add(batchSize);
    Pattern regex = globToRegex(matchPattern);
    return new ArrayList<>(values.keySet()).stream().filter(key -> regex.matcher(key).matches());
  }

  public void failWritesTo(String key) {
    failingWrites.add(key);
  }

  public void evict(String key) {
    values.remove(key);
    ttls.remove(key);
  }

  public Long ttl(String key) {
    return ttls.get(key);
  }

  public Set<String> keys() {
    return values.keySet();
  }

  public int expireCalls() {
    return expireCalls;
  }

  public List<Integer> scanBatchSizes() {
    return scanBatchSizes;
  }

  private static Pattern globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (c == '\\' && i + 1 < glob.length()) {
        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
      } else if (c == '*') {
        regex.append(".*");
      } else if (c == '?') {
        regex.append('.');
      } else {
        regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
