package com.example.syncreconciler.assign;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal polled by a running assignment between directory entries. Hosts raise
 * it from another thread on shutdown or when the sync being resumed is disabled.
 */
@FunctionalInterface
public interface TraversalInterrupt {
    boolean isRequested();

    static TraversalInterrupt never() {
        return () -> false;
    }

    static TraversalInterrupt of(AtomicBoolean flag) {
        return flag::get;
    }
}
