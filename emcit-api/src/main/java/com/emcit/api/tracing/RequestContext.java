package com.emcit.api.tracing;

/**
 * Lightweight per-request context stored in ThreadLocal.
 *
 * Holds the correlation id and the caller's origin address so audit rows written deep in the
 * core can be tied back to the HTTP request.
 */
public final class RequestContext {

  private static final ThreadLocal<Ctx> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId, String originAddress) {
    TL.set(new Ctx(requestId, originAddress));
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    Ctx c = TL.get();
    return c == null ? null : c.requestId;
  }

  public static String originAddress() {
    Ctx c = TL.get();
    return c == null ? "Unknown" : c.originAddress;
  }

  private record Ctx(String requestId, String originAddress) {}
}
