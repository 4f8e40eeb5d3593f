package com.relaytide.model;

/**
 * Which push channel a notification arrived on.
 * MAIL_PUSH     → Gmail via Cloud Pub/Sub push subscription
 * CALENDAR_PUSH → Google Calendar web_hook channel
 */
public enum IngestionSource {
    MAIL_PUSH,
    CALENDAR_PUSH
}
