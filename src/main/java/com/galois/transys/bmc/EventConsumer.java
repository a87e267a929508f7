package com.galois.transys.bmc;

/** Receives the events of a run. */
public interface EventConsumer {
    void acceptEvent(BmcEvent event);
}
