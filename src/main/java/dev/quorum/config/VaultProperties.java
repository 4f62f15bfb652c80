package dev.quorum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process-wide key for the per-installation API key ciphertexts. Hex, 32 bytes.
 */
@ConfigurationProperties(prefix = "quorum.vault")
public record VaultProperties(String encryptionKey) {

    @Override
    public String toString() {
        return "VaultProperties[encryptionKey=****]";
    }
}
