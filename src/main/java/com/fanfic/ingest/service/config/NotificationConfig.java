package com.fanfic.ingest.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the notification channel.
 *
 * When no webhook URL is configured, notifications are only logged.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fanfic.notification")
public class NotificationConfig {

    /**
     * Endpoint that receives notifications as a JSON POST.
     */
    private String webhookUrl;

    private long connectTimeoutMs = 5000;

    private long readTimeoutMs = 10000;

    public boolean isWebhookConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
