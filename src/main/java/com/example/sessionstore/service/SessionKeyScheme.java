package com.example.sessionstore.service;

import java.util.regex.Pattern;
import lombok.Getter;

/**
 * Derives the Redis key layout for one session namespace.
 *
 * <pre>
 *   primary key : prefix + sessionId                                 e.g. sess:abc
 *   index key   : prefixRoot + separator + userId + separator + sid  e.g. sess:u1:abc
 * </pre>
 *
 * The index key's value is the primary key string. Both live under {@code prefix*}, so a
 * primary key is recognized by a suffix that does not contain the separator.
 */
@Getter
public class SessionKeyScheme {

  public static final String DEFAULT_PREFIX = "sess:";
  private static final String DEFAULT_SEPARATOR = ":";
  private static final Pattern PREFIX_WITH_SEPARATOR = Pattern.compile("^\\w+\\W$");

  private final String prefix;
  private final String prefixRoot;
  private final char separator;

  public SessionKeyScheme(String prefix) {
    String configured = prefix == null ? DEFAULT_PREFIX : prefix;
    if (!PREFIX_WITH_SEPARATOR.matcher(configured).matches()) {
      configured += DEFAULT_SEPARATOR;
    }
    this.prefix = configured;
    this.prefixRoot = configured.substring(0, configured.length() - 1);
    this.separator = configured.charAt(configured.length() - 1);
  }

  public String primaryKey(String sessionId) {
    return prefix + sessionId;
  }

  public String userIndexKey(String userId, String sessionId) {
    return userPrefix(userId) + sessionId;
  }

  public String sessionId(String primaryKey) {
    return primaryKey.substring(prefix.length());
  }

  /**
   * Maps an index key found by {@link #userIndexPattern(String)} back to its primary key
   * without reading the index value.
   */
  public String primaryKeyForIndexKey(String userId, String indexKey) {
    return prefix + indexKey.substring(userPrefix(userId).length());
  }

  public boolean isPrimaryKey(String key) {
    return key.startsWith(prefix) && key.indexOf(separator, prefix.length()) < 0;
  }

  /**
   * @return true if {@code value} can be embedded in a key without breaking decomposition
   */
  public boolean isKeySafe(String value) {
    return value != null && !value.isEmpty() && value.indexOf(separator) < 0;
  }

  /**
   * Matches every key of the namespace: primary and index keys alike.
   */
  public String namespacePattern() {
    return escapeGlob(prefixRoot + separator) + "*";
  }

  public String userIndexPattern(String userId) {
    return escapeGlob(userPrefix(userId)) + "*";
  }

  private String userPrefix(String userId) {
    return prefixRoot + separator + userId + separator;
  }

  static String escapeGlob(String literal) {
    StringBuilder escaped = new StringBuilder(literal.length());
    for (char c : literal.toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
