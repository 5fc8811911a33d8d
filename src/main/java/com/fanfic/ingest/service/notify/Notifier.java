package com.fanfic.ingest.service.notify;

/**
 * Sink for notifications about URLs that are diverted away from processing.
 *
 * Delivery is fire-and-forget: implementations handle their own failures and
 * must not throw back into the caller.
 */
public interface Notifier {

    /**
     * Sends one notification.
     *
     * @param title notification title
     * @param body notification body, typically the normalized URL
     * @param tag site identifier the notification is about
     */
    void notify(String title, String body, String tag);
}
