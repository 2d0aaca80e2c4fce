package com.pocketplan.forecast.web;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Per-thread request context. The trace id is mirrored into the logging MDC for as long as the
 * context is open.
 */
public final class RequestContextHolder {

    public static final String MDC_KEY = "trace_id";

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static Scope open(String traceId) {
        CONTEXT.set(new RequestContext(traceId));
        MDC.put(MDC_KEY, traceId);
        return RequestContextHolder::clear;
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
        CONTEXT.remove();
    }

    public record RequestContext(String traceId) {
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
