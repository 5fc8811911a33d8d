package com.fanfic.ingest.service.ingest;

/**
 * What happened to one item handed to the {@link UrlDispatcher}.
 */
public enum DispatchOutcome {
    QUEUED,
    NOTIFIED,
    DROPPED_UNCLASSIFIABLE,
    DROPPED_NO_DESTINATION,
    DROPPED_ENQUEUE_FAILED;

    public boolean isDelivered() {
        return this == QUEUED || this == NOTIFIED;
    }
}
