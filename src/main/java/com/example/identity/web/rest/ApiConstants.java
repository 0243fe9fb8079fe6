package com.example.identity.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String SESSION = "/session";
    public static final String LOGOUT = "/logout";
    public static final String STATUS = "/status";
    public static final String ME = "/me";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
