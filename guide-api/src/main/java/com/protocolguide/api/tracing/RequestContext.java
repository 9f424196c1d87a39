package com.protocolguide.api.tracing;

/**
 * Request id of the HTTP request being served on this thread, or null outside one.
 * Set and cleared by {@link RequestIdFilter}; read by error bodies.
 */
public final class RequestContext {

  private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

  private RequestContext() {}

  static void set(String requestId) {
    REQUEST_ID.set(requestId);
  }

  static void clear() {
    REQUEST_ID.remove();
  }

  public static String requestId() {
    return REQUEST_ID.get();
  }
}
