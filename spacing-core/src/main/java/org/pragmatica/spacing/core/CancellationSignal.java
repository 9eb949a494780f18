package org.pragmatica.spacing.core;

/**
 * Cooperative cancellation hook supplied by the host; polled between tokens.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();
}
