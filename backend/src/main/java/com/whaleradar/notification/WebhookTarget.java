package com.whaleradar.notification;

/** Webhook payload flavour. */
public enum WebhookTarget {
    SLACK,
    DISCORD
}
