package com.example.pipeline.event;

/**
 * Receiver of committed status changes (notification, audit). Called off the transition path;
 * an exception thrown here never affects the committed change.
 */
@FunctionalInterface
public interface StatusChangeEventSink {

    void onStatusChanged(StatusChangeEvent event);
}
