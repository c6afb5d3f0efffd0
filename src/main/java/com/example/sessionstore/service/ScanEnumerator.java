package com.example.sessionstore.service;

import com.example.sessionstore.adapter.redis.client.SessionKeyValueClient;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Materializes key lists for bulk operations by draining an incremental SCAN.
 * Batches are fetched strictly one after another.
 */
@Slf4j
@RequiredArgsConstructor
public class ScanEnumerator {

  private final SessionKeyValueClient client;
  private final SessionKeyScheme keyScheme;
  private final int batchSize;

  /**
   * Primary and index keys of the whole namespace.
   */
  public List<String> namespaceKeys() {
    return collect(keyScheme.namespacePattern());
  }

  public List<String> primaryKeys() {
    return namespaceKeys().stream()
        .filter(keyScheme::isPrimaryKey)
        .collect(Collectors.toList());
  }

  public List<String> userIndexKeys(String userId) {
    return collect(keyScheme.userIndexPattern(userId));
  }

  /**
   * Index keys of the user followed, pairwise, by the primary keys they point to.
   */
  public List<String> userKeys(String userId) {
    List<String> keys = new ArrayList<>();
    for (String indexKey : userIndexKeys(userId)) {
      keys.add(indexKey);
      keys.add(keyScheme.primaryKeyForIndexKey(userId, indexKey));
    }
    return keys;
  }

  private List<String> collect(String pattern) {
    try (Stream<String> keys = client.scan(pattern, batchSize)) {
      List<String> result = keys.collect(Collectors.toList());
      log.debug("Scan of {} found {} keys", pattern, result.size());
      return result;
    }
  }
}
