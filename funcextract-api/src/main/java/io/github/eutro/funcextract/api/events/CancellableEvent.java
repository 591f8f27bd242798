package io.github.eutro.funcextract.api.events;

/**
 * An event that can be cancelled, which stops later listeners from receiving it and
 * skips whatever the event announced.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}
