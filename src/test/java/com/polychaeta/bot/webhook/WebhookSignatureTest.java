package com.polychaeta.bot.webhook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WebhookSignature Tests")
class WebhookSignatureTest {

    private static final byte[] BODY = "Hello, World!".getBytes(StandardCharsets.UTF_8);

    private final WebhookSignature signature = new WebhookSignature("It's a Secret to Everybody");

    @Test
    @DisplayName("Should match the published sha256 example")
    void shouldMatchPublishedExample() {
        String expected = "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17";

        assertThat(signature.sign256(BODY)).isEqualTo(expected);
        assertThat(signature.isValid(BODY, expected, null)).isTrue();
    }

    @Test
    @DisplayName("Should accept the legacy sha1 header when sha256 is absent")
    void shouldAcceptSha1() {
        assertThat(signature.isValid(BODY, null, signature.sign1(BODY))).isTrue();
    }

    @Test
    @DisplayName("Should prefer sha256 over sha1")
    void shouldPreferSha256() {
        assertThat(signature.isValid(BODY, "sha256=deadbeef", signature.sign1(BODY))).isFalse();
    }

    @Test
    @DisplayName("Should reject a tampered body")
    void shouldRejectTamperedBody() {
        String sig = signature.sign256(BODY);

        assertThat(signature.isValid("Hello, World?".getBytes(StandardCharsets.UTF_8), sig, null)).isFalse();
    }

    @Test
    @DisplayName("Should reject a signature made with another secret")
    void shouldRejectOtherSecret() {
        String sig = new WebhookSignature("other").sign256(BODY);

        assertThat(signature.isValid(BODY, sig, null)).isFalse();
    }

    @Test
    @DisplayName("Should reject deliveries without any signature header")
    void shouldRejectMissingHeaders() {
        assertThat(signature.isValid(BODY, null, null)).isFalse();
    }

    @Test
    @DisplayName("Should accept the published sha256 header value")
    void shouldAcceptPublishedHeader() {
        String header = "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17";

        assertThat(signature.isValid(BODY, " " + header + " ", null)).isTrue();
    }
}
