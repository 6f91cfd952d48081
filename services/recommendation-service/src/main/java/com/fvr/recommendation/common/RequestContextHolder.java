package com.fvr.recommendation.common;

/**
 * Request/trace ids for log lines and error bodies. Carries no recommendation
 * state; likes overrides travel explicitly as {@code LikesScope}.
 */
public final class RequestContextHolder {
    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static RequestContext get() {
        return CONTEXT.get();
    }

    public static String currentRequestId() {
        RequestContext context = CONTEXT.get();
        return context == null ? "-" : context.getRequestId();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
