package io.twingraph.events.sink.webhook;

public enum WebhookAuthType {
    NONE,
    BASIC,
    BEARER,
    API_KEY,
    OAUTH
}
