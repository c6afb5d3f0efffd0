package com.example.sessionstore.domain.entity;

/**
 * A session read back from the store together with the id derived from its key.
 */
public record StoredSession(String id, SessionData data) {}
