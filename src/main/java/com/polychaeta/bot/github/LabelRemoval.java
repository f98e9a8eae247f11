package com.polychaeta.bot.github;

/**
 * Outcome of removing a label from an issue. Only {@link #FAILED} is an error;
 * {@link #ALREADY_ABSENT} means the issue is already in the desired state.
 */
public enum LabelRemoval {
    REMOVED,
    ALREADY_ABSENT,
    FAILED
}
