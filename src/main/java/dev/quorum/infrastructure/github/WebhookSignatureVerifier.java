package dev.quorum.infrastructure.github;

import dev.quorum.config.GitHubProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the exact raw body, hex-encoded with GitHub's {@code sha256=} prefix.
 * Comparison is constant-time.
 */
@Component
public class WebhookSignatureVerifier {

    static final String PREFIX = "sha256=";

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) {
        this.properties = properties;
    }

    public boolean isValid(byte[] payload, String signature) {
        if (signature == null || !signature.startsWith(PREFIX)) return false;
        String secret = properties.webhookSecret();
        if (secret == null || secret.isBlank()) return false;
        String expected = sign(secret, payload);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }

    public static String sign(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
