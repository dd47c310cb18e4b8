package com.example.pipeline.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands committed status changes to every registered sink on an {@link Executor}. Delivery
 * failures and executor rejections are logged and dropped; {@link #publish} never throws.
 */
public class StatusChangePublisher {

    private static final Logger log = LoggerFactory.getLogger(StatusChangePublisher.class);

    private final Executor executor;
    private final List<StatusChangeEventSink> sinks;

    public StatusChangePublisher(Executor executor, List<StatusChangeEventSink> sinks) {
        this.executor = executor;
        this.sinks = List.copyOf(sinks);
    }

    public void publish(StatusChangeEvent event) {
        for (StatusChangeEventSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, event));
            } catch (RejectedExecutionException e) {
                log.warn("Status change event for candidate {} dropped, dispatcher rejected it: {}",
                        event.candidateId(), e.getMessage());
            }
        }
    }

    private static void deliver(StatusChangeEventSink sink, StatusChangeEvent event) {
        try {
            sink.onStatusChanged(event);
        } catch (RuntimeException e) {
            log.warn("Status change event for candidate {} ({} -> {}) not delivered to {}: {}",
                    event.candidateId(), event.oldStatus(), event.newStatus(),
                    sink.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
