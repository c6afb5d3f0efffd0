package com.example.sessionstore.service.codec;

import com.example.sessionstore.domain.entity.SessionData;
import com.example.sessionstore.exception.SessionSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Default codec: the session as a flat JSON document, timestamps as ISO-8601 strings.
 */
public class JacksonSessionSerializer implements SessionSerializer {

  private final ObjectMapper objectMapper;

  public JacksonSessionSerializer() {
    this(JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build());
  }

  public JacksonSessionSerializer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public SessionData parse(String text) {
    try {
      return objectMapper.readValue(text, SessionData.class);
    } catch (JsonProcessingException e) {
      throw new SessionSerializationException("Failed to parse session payload", e);
    }
  }

  @Override
  public String stringify(SessionData session) {
    try {
      return objectMapper.writeValueAsString(session);
    } catch (JsonProcessingException e) {
      throw new SessionSerializationException("Failed to serialize session payload", e);
    }
  }
}
