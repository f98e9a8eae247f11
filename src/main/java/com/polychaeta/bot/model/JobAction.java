package com.polychaeta.bot.model;

public enum JobAction {
    CLOSE_ISSUE
}
