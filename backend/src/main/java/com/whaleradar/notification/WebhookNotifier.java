package com.whaleradar.notification;

import com.whaleradar.domain.Finding;
import com.whaleradar.domain.TradeCluster;
import com.whaleradar.notification.config.NotificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts messages to a Slack incoming webhook (blocks payload) or a Discord webhook (content payload).
 * Failures are logged and reported as false; nothing is retried.
 */
@Component
@Slf4j
public class WebhookNotifier implements Notifier {

    /** Discord rejects content longer than 2000 characters. */
    static final int DISCORD_CONTENT_LIMIT = 2000;

    private final WebClient webClient;
    private final NotificationProperties properties;

    public WebhookNotifier(WebClient.Builder webClientBuilder, NotificationProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public boolean notify(String address, List<Finding> findings, boolean elevated) {
        if (findings == null || findings.isEmpty()) {
            return false;
        }
        return send(WebhookMessageFormatter.findings(address, findings, elevated));
    }

    @Override
    public boolean notifyCluster(TradeCluster cluster) {
        return send(WebhookMessageFormatter.cluster(cluster));
    }

    @Override
    public boolean notifyStatus(StatusKind kind, Map<String, ?> details) {
        return send(WebhookMessageFormatter.status(kind, details));
    }

    boolean send(WebhookMessage message) {
        if (!properties.isConfigured()) {
            log.info("No webhook configured, message not sent: {}\n{}", message.title(), message.body());
            return false;
        }
        try {
            webClient.post()
                    .uri(properties.getWebhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(message))
                    .retrieve()
                    .toBodilessEntity()
                    .block(Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())));
            log.debug("Webhook delivered: {}", message.title());
            return true;
        } catch (RuntimeException e) {
            log.warn("Webhook delivery failed for '{}': {}", message.title(), e.getMessage());
            return false;
        }
    }

    Map<String, Object> payload(WebhookMessage message) {
        String mention = properties.getMention() == null ? "" : properties.getMention().strip();
        if (properties.getTarget() == WebhookTarget.DISCORD) {
            StringBuilder content = new StringBuilder();
            if (!mention.isEmpty()) {
                content.append(mention).append('\n');
            }
            content.append("**").append(message.title()).append("**\n").append(message.body());
            String text = content.length() > DISCORD_CONTENT_LIMIT
                    ? content.substring(0, DISCORD_CONTENT_LIMIT - 3) + "..."
                    : content.toString();
            return Map.of("content", text);
        }
        String body = mention.isEmpty() ? message.body() : mention + "\n" + message.body();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", message.title());
        payload.put("blocks", List.of(
                Map.of("type", "header", "text", Map.of("type", "plain_text", "text", message.title())),
                Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", body.isEmpty() ? " " : body)),
                Map.of("type", "divider")));
        return payload;
    }
}
