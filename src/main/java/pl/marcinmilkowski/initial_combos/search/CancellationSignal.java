package pl.marcinmilkowski.initial_combos.search;

/**
 * Cooperative cancellation, polled by the engine between search levels.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();
}
