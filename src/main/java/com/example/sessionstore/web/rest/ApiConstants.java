package com.example.sessionstore.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String ADMIN = "/admin";

    // Session paths
    public static final String SESSIONS = "/sessions";
    public static final String USERS = "/users";
    public static final String IDS = "/ids";
    public static final String COUNT = "/count";
    public static final String SESSION_ID = "/{sessionId}";
    public static final String USER_SESSIONS = USERS + "/{userId}" + SESSIONS;

    private ApiPath() {}
  }

  private ApiConstants() {}
}
