package com.polychaeta.bot.webhook;

/**
 * A recognized delivery lacks a field its handler needs.
 */
public class MalformedPayloadException extends Exception {
    public MalformedPayloadException(String message) {
        super(message);
    }
}
