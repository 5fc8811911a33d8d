package com.fanfic.ingest.service.notify;

import com.fanfic.ingest.service.config.NotificationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notifier that POSTs each notification as JSON to a configured webhook.
 *
 * Delivery errors are logged and suppressed.
 */
@Slf4j
public class WebhookNotifier implements Notifier {

    private final String webhookUrl;
    private final RestTemplate restTemplate;

    public WebhookNotifier(NotificationConfig config, RestTemplateBuilder restTemplateBuilder) {
        this.webhookUrl = config.getWebhookUrl();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
    }

    @Override
    public void notify(String title, String body, String tag) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("body", body);
        payload.put("tag", tag);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            restTemplate.postForEntity(webhookUrl, new HttpEntity<>(payload, headers), Void.class);
            log.debug("Notification posted to webhook: tag={}, body={}", tag, body);
        } catch (RestClientException e) {
            log.warn("Notification webhook failed for {}: {}", body, e.getMessage());
        }
    }
}
