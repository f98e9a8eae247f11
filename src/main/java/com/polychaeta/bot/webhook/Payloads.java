package com.polychaeta.bot.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.polychaeta.bot.model.IssueRef;

import java.util.Optional;

/**
 * Field access on webhook JSON payloads.
 */
final class Payloads {
    private Payloads() {
    }

    static Optional<String> text(JsonNode node, String... path) {
        JsonNode target = at(node, path);
        return target.isTextual() ? Optional.of(target.asText()) : Optional.empty();
    }

    static String requireText(JsonNode node, String... path) throws MalformedPayloadException {
        return text(node, path).orElseThrow(() -> missing(path));
    }

    static long requireLong(JsonNode node, String... path) throws MalformedPayloadException {
        JsonNode target = at(node, path);
        if (!target.canConvertToLong()) throw missing(path);
        return target.asLong();
    }

    static int requirePositiveInt(JsonNode node, String... path) throws MalformedPayloadException {
        JsonNode target = at(node, path);
        if (!target.canConvertToInt() || target.asInt() <= 0) throw missing(path);
        return target.asInt();
    }

    static IssueRef issue(JsonNode payload) throws MalformedPayloadException {
        return new IssueRef(requireText(payload, "repository", "full_name"),
                requirePositiveInt(payload, "issue", "number"));
    }

    static IssueRef pullRequest(JsonNode payload) throws MalformedPayloadException {
        return new IssueRef(requireText(payload, "repository", "full_name"),
                requirePositiveInt(payload, "number"));
    }

    private static JsonNode at(JsonNode node, String... path) {
        JsonNode target = node;
        for (String p : path) {
            target = target.path(p);
        }
        return target;
    }

    private static MalformedPayloadException missing(String... path) {
        return new MalformedPayloadException("Missing or invalid field " + String.join(".", path));
    }
}
