package com.whaleradar.notification;

import java.util.List;

/**
 * Target-neutral message: a title and body lines. Lines may use *bold* and `code` markup,
 * which both Slack mrkdwn and Discord render.
 */
public record WebhookMessage(String title, List<String> lines) {

    public String body() {
        return String.join("\n", lines);
    }
}
