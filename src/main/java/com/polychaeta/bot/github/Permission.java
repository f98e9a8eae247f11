package com.polychaeta.bot.github;

import java.util.Locale;

/**
 * Collaborator permission on a repository, highest first.
 */
public enum Permission {
    ADMIN,
    MAINTAIN,
    WRITE,
    TRIAGE,
    READ,
    NONE;

    public static Permission fromApi(String value) {
        if (value == null) return NONE;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return NONE;
        }
    }
}
