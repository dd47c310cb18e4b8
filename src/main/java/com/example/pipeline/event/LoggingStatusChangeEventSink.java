package com.example.pipeline.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Audit-log sink used when no notification service is wired in. */
public class LoggingStatusChangeEventSink implements StatusChangeEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingStatusChangeEventSink.class);

    @Override
    public void onStatusChanged(StatusChangeEvent event) {
        log.info("[audit] candidate={} ({}) status {} -> {} by={} history={}",
                event.candidateId(), event.candidateName(),
                event.oldStatus() == null ? "-" : event.oldStatus().label(),
                event.newStatus().label(), event.actor().id(), event.historyId());
    }
}
