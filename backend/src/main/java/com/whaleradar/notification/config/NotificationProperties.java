package com.whaleradar.notification.config;

import com.whaleradar.notification.WebhookTarget;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Webhook delivery settings. Without a webhook URL, messages are only logged.
 */
@ConfigurationProperties(prefix = "whaleradar.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    private String webhookUrl = "";

    private WebhookTarget target = WebhookTarget.SLACK;

    private long timeoutMs = 10_000;

    /** Optional first line of every message, e.g. "<!channel>" or "@here". */
    private String mention = "";

    public boolean isConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
