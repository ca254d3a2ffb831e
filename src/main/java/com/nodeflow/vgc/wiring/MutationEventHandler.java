package com.nodeflow.vgc.wiring;

/**
 * Consumer-side callback of a {@link MutationEventBridge}. Runs on the
 * bridge's consumer thread, one event at a time, in publication order.
 */
@FunctionalInterface
public interface MutationEventHandler {

    /**
     * @param event      Reused flyweight; copy what must outlive the call.
     * @param endOfBatch True when no further event is immediately available.
     */
    void onMutation(MutationEvent event, boolean endOfBatch);
}
