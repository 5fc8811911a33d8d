package com.fanfic.ingest.service.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Notifier that only writes the notification to the application log.
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void notify(String title, String body, String tag) {
        log.info("[{}] {}: {}", tag, title, body);
    }
}
