package com.polychaeta.bot.webhook;

import java.util.Arrays;
import java.util.Optional;

/**
 * The (event, action) pairs the bot reacts to.
 */
public enum WebhookRoute {
    ISSUES_LABELED("issues", "labeled"),
    ISSUE_COMMENT_CREATED("issue_comment", "created"),
    PULL_REQUEST_OPENED("pull_request", "opened");

    public final String event;
    public final String action;

    WebhookRoute(String event, String action) {
        this.event = event;
        this.action = action;
    }

    public static boolean isKnownEvent(String event) {
        return Arrays.stream(values()).anyMatch(r -> r.event.equals(event));
    }

    public static Optional<WebhookRoute> of(String event, String action) {
        return Arrays.stream(values())
                .filter(r -> r.event.equals(event) && r.action.equals(action))
                .findFirst();
    }
}
