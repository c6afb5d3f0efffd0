package com.example.sessionstore.service.codec;

import com.example.sessionstore.domain.entity.SessionData;

/**
 * Converts session records to and from the string stored in Redis.
 * Implementations signal malformed input with an unchecked exception.
 */
public interface SessionSerializer {

  SessionData parse(String text);

  String stringify(SessionData session);
}
