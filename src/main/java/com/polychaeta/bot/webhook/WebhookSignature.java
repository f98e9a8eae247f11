package com.polychaeta.bot.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Verifies {@code X-Hub-Signature-256} ({@code sha256=<hex>}) or, when that is
 * absent, the legacy {@code X-Hub-Signature} ({@code sha1=<hex>}) header.
 */
public final class WebhookSignature {
    public static final String SHA256_HEADER = "X-Hub-Signature-256";
    public static final String SHA1_HEADER = "X-Hub-Signature";

    private final byte[] secret;

    public WebhookSignature(String secret) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isValid(byte[] body, String sha256Header, String sha1Header) {
        if (sha256Header != null) {
            return safeEqual(sha256Header.trim(), sign256(body));
        }
        if (sha1Header != null) {
            return safeEqual(sha1Header.trim(), sign1(body));
        }
        return false;
    }

    String sign256(byte[] body) {
        return "sha256=" + hmac("HmacSHA256", body);
    }

    String sign1(byte[] body) {
        return "sha1=" + hmac("HmacSHA1", body);
    }

    private String hmac(String algorithm, byte[] body) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret, algorithm));
            byte[] hash = mac.doFinal(body);
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC computation failed", e);
        }
    }

    private static boolean safeEqual(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
