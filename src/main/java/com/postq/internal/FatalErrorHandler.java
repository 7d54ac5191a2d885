package com.postq.internal;

/**
 * Called when the scheduler cannot reach its store for too long to keep running.
 * Register a bean of this type to replace the default, which stops the process.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void onFatalError(String reason, Throwable cause);
}
