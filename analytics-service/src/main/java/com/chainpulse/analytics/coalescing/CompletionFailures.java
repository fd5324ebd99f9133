package com.chainpulse.analytics.coalescing;

import com.chainpulse.common.exception.ComputeException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class CompletionFailures {

    private CompletionFailures() {
        // utility
    }

    /**
     * Strips future wrappers and returns something a controller advice can map.
     */
    public static RuntimeException unwrap(Throwable failure, String adapter) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ComputeException(adapter, "Computation failed: " + cause, cause);
    }

    /**
     * {@code contracts:total-txs:1f2e...} → {@code contracts:total-txs}
     */
    public static String adapterOf(String key) {
        if (key == null) {
            return null;
        }
        int idx = key.lastIndexOf(':');
        return idx > 0 ? key.substring(0, idx) : key;
    }
}
