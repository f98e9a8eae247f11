package com.polychaeta.bot.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BotConfig Tests")
class BotConfigTest {

    @TempDir
    Path tempDir;

    private static Map<String, String> required() {
        Map<String, String> env = new HashMap<>();
        env.put("GITHUB_TOKEN", "ghp_token");
        env.put("WEBHOOK_SECRET", "secret");
        return env;
    }

    @Test
    @DisplayName("Should apply defaults")
    void shouldApplyDefaults() {
        BotConfig config = BotConfig.from(required());

        assertThat(config.githubToken).isEqualTo("ghp_token");
        assertThat(config.webhookSecret).isEqualTo("secret");
        assertThat(config.dbPath).isEqualTo("jobs.sqlite");
        assertThat(config.httpPort).isEqualTo(5000);
        assertThat(config.webhookPath).isEqualTo("/payload");
        assertThat(config.triggerLabel).isEqualTo("autoclose");
        assertThat(config.autocloseDays).isEqualTo(7);
        assertThat(config.logLevel).isEqualTo("INFO");
    }

    @Test
    @DisplayName("Should read overrides from the environment")
    void shouldReadOverrides() {
        Map<String, String> env = required();
        env.put("DB_PATH", "/data/jobs.db");
        env.put("HTTP_PORT", " 8080 ");
        env.put("WEBHOOK_PATH", "hooks/github");
        env.put("TRIGGER_LABEL", "stale");
        env.put("AUTOCLOSE_DAYS", "14");
        env.put("LOG_LEVEL", "debug");

        BotConfig config = BotConfig.from(env);

        assertThat(config.dbPath).isEqualTo("/data/jobs.db");
        assertThat(config.httpPort).isEqualTo(8080);
        assertThat(config.webhookPath).isEqualTo("/hooks/github");
        assertThat(config.triggerLabel).isEqualTo("stale");
        assertThat(config.autocloseDays).isEqualTo(14);
        assertThat(config.logLevel).isEqualTo("DEBUG");
    }

    @Test
    @DisplayName("Should fail fast on missing secrets")
    void shouldRequireSecrets() {
        assertThatThrownBy(() -> BotConfig.from(Map.of("GITHUB_TOKEN", "t")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("WEBHOOK_SECRET");
        assertThatThrownBy(() -> BotConfig.from(Map.of("WEBHOOK_SECRET", "s", "GITHUB_TOKEN", "  ")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GITHUB_TOKEN");
    }

    @Test
    @DisplayName("Should fail fast on malformed numbers")
    void shouldRejectMalformedNumbers() {
        Map<String, String> env = required();
        env.put("HTTP_PORT", "eighty");

        assertThatThrownBy(() -> BotConfig.from(env))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HTTP_PORT");
    }

    @Test
    @DisplayName("Should reject a non-positive delay")
    void shouldRejectNonPositiveDelay() {
        Map<String, String> env = required();
        env.put("AUTOCLOSE_DAYS", "0");

        assertThatThrownBy(() -> BotConfig.from(env)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should take secrets from the YAML file and let the environment win")
    void shouldReadYamlFile() throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                gh_webhook_secret: from-file-secret
                gh_auth_token: from-file-token
                """);

        BotConfig fromFile = BotConfig.from(Map.of("CONFIG_FILE", file.toString()));
        BotConfig mixed = BotConfig.from(Map.of("CONFIG_FILE", file.toString(), "GITHUB_TOKEN", "env-token"));

        assertThat(fromFile.webhookSecret).isEqualTo("from-file-secret");
        assertThat(fromFile.githubToken).isEqualTo("from-file-token");
        assertThat(mixed.githubToken).isEqualTo("env-token");
        assertThat(mixed.webhookSecret).isEqualTo("from-file-secret");
    }

    @Test
    @DisplayName("Should fail when the config file cannot be read")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> BotConfig.from(Map.of("CONFIG_FILE", tempDir.resolve("nope.yaml").toString())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nope.yaml");
    }

    @Test
    @DisplayName("Should give the logger level in lower case regardless of the default locale")
    void shouldLowercaseLevelIndependentOfLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Map<String, String> env = required();
            env.put("LOG_LEVEL", "info");

            BotConfig config = BotConfig.from(env);

            assertThat(config.logLevel).isEqualTo("INFO");
            assertThat(config.simpleLoggerLevel()).isEqualTo("info");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
