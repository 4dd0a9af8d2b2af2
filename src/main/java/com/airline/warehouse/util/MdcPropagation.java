package com.airline.warehouse.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the SLF4J MDC of the submitting thread (the load's {@code runId}) over to the
 * loader's worker threads, so their log lines stay correlated with the run.
 * <p>
 * Usage: {@code CompletableFuture.runAsync(MdcPropagation.wrapRunnable(() -> merge(group)), executor);}
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";

    private MdcPropagation() {
    }

    /**
     * Captures the current MDC and returns a Runnable that sets it for the duration of the
     * task and removes it again in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        contextMap.forEach(MDC::put);
    }

    private static void clearMdc(Map<String, String> contextMap) {
        contextMap.keySet().forEach(MDC::remove);
    }
}
