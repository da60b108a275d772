package com.wastewrangler.shared.util;

import org.slf4j.MDC;

/**
 * MDC helpers that tag log lines with the public operation being served.
 *
 * <pre>
 * try (OperationContext.Scope ignored = OperationContext.open("scheduleTrip")) {
 *     ...
 * }
 * </pre>
 */
public final class OperationContext {

    public static final String OPERATION_KEY = "operation";

    private OperationContext() {
        // Utility class - prevent instantiation
    }

    /**
     * Puts the operation name into the MDC until the returned scope is closed.
     * A previously set operation (nested call) is restored on close.
     */
    public static Scope open(String operation) {
        String previous = MDC.get(OPERATION_KEY);
        MDC.put(OPERATION_KEY, operation);
        return new Scope(previous);
    }

    public static String current() {
        return MDC.get(OPERATION_KEY);
    }

    public static final class Scope implements AutoCloseable {

        private final String previous;

        private Scope(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous != null) {
                MDC.put(OPERATION_KEY, previous);
            } else {
                MDC.remove(OPERATION_KEY);
            }
        }
    }
}
