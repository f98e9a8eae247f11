package com.polychaeta.bot.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class BotConfig {
    public final String githubToken;
    public final String webhookSecret;

    public final String dbPath;

    public final int httpPort;
    public final String webhookPath;

    public final String triggerLabel;
    public final int autocloseDays;

    public final String logLevel;

    private BotConfig(
            String githubToken,
            String webhookSecret,
            String dbPath,
            int httpPort,
            String webhookPath,
            String triggerLabel,
            int autocloseDays,
            String logLevel
    ) {
        this.githubToken = githubToken;
        this.webhookSecret = webhookSecret;
        this.dbPath = dbPath;
        this.httpPort = httpPort;
        this.webhookPath = webhookPath;
        this.triggerLabel = triggerLabel;
        this.autocloseDays = autocloseDays;
        this.logLevel = logLevel;
    }

    /**
     * Level name in the form {@code org.slf4j.simpleLogger.defaultLogLevel} expects.
     */
    public String simpleLoggerLevel() {
        return logLevel.toLowerCase(Locale.ROOT);
    }

    public static BotConfig fromEnv() {
        return from(System.getenv());
    }

    /**
     * Environment values win; {@code gh_auth_token} and {@code gh_webhook_secret}
     * may also come from the YAML file named by {@code CONFIG_FILE}.
     */
    public static BotConfig from(Map<String, String> env) {
        Optional<JsonNode> file = value(env, "CONFIG_FILE").map(BotConfig::readYaml);

        String token = value(env, "GITHUB_TOKEN")
                .or(() -> file.flatMap(f -> yamlValue(f, "gh_auth_token")))
                .orElseThrow(() -> missing("GITHUB_TOKEN"));
        String secret = value(env, "WEBHOOK_SECRET")
                .or(() -> file.flatMap(f -> yamlValue(f, "gh_webhook_secret")))
                .orElseThrow(() -> missing("WEBHOOK_SECRET"));

        String dbPath = value(env, "DB_PATH").orElse("jobs.sqlite");
        int port = parseInt("HTTP_PORT", value(env, "HTTP_PORT").orElse("5000"));
        String path = value(env, "WEBHOOK_PATH").orElse("/payload");
        if (!path.startsWith("/")) {
            path = "/" + path;
        }

        String triggerLabel = value(env, "TRIGGER_LABEL").orElse("autoclose");
        int days = parseInt("AUTOCLOSE_DAYS", value(env, "AUTOCLOSE_DAYS").orElse("7"));
        if (days <= 0) {
            throw new IllegalStateException("AUTOCLOSE_DAYS must be positive: " + days);
        }

        String logLevel = value(env, "LOG_LEVEL").orElse("INFO").toUpperCase(Locale.ROOT);

        return new BotConfig(token, secret, dbPath, port, path, triggerLabel, days, logLevel);
    }

    private static JsonNode readYaml(String file) {
        try {
            return new ObjectMapper(new YAMLFactory()).readTree(Files.readAllBytes(Path.of(file)));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read config file " + file, e);
        }
    }

    private static Optional<String> yamlValue(JsonNode root, String key) {
        return Optional.ofNullable(root)
                .map(r -> r.get(key))
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    private static Optional<String> value(Map<String, String> env, String name) {
        return Optional.ofNullable(env.get(name)).map(String::trim).filter(s -> !s.isEmpty());
    }

    private static IllegalStateException missing(String name) {
        return new IllegalStateException("Missing required ENV variable: " + name);
    }

    private static int parseInt(String name, String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid int ENV value for " + name + ": " + s, e);
        }
    }
}
