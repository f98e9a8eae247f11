package com.polychaeta.bot.github;

public enum ReviewEvent {
    APPROVE,
    REQUEST_CHANGES,
    COMMENT
}
