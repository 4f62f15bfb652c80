package dev.quorum.infrastructure.crypto;

import dev.quorum.config.VaultProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.security.GeneralSecurityException;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenCipherTest {

    static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
    static final String OTHER_KEY = "ffeeddccbbaa99887766554433221100ffeeddccbbaa99887766554433221100";

    private final TokenCipher cipher = new TokenCipher(new VaultProperties(KEY));

    @Nested
    @DisplayName("Encrypt and decrypt")
    class RoundTrip {

        @Test
        @DisplayName("decrypts what it encrypted")
        void roundTrip() throws Exception {
            String sealed = cipher.encrypt("AIzaSy-test-key");

            assertThat(new String(cipher.decrypt(sealed))).isEqualTo("AIzaSy-test-key");
        }

        @Test
        @DisplayName("stores a 12-byte IV and never the plaintext")
        void format() {
            String sealed = cipher.encrypt("AIzaSy-test-key");
            String[] parts = sealed.split(":");

            assertThat(parts).hasSize(2);
            assertThat(Base64.getDecoder().decode(parts[0])).hasSize(12);
            assertThat(sealed).doesNotContain("AIzaSy");
        }

        @Test
        @DisplayName("uses a fresh IV for every value")
        void freshIv() {
            assertThat(cipher.encrypt("same")).isNotEqualTo(cipher.encrypt("same"));
        }

        @Test
        @DisplayName("refuses to encrypt nothing")
        void rejectsEmpty() {
            assertThatThrownBy(() -> cipher.encrypt("")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Rejected ciphertext")
    class Rejected {

        @Test
        @DisplayName("a flipped ciphertext byte fails the tag check")
        void tampered() {
            String[] parts = cipher.encrypt("AIzaSy-test-key").split(":");
            byte[] ct = Base64.getDecoder().decode(parts[1]);
            ct[0] ^= 0x01;
            String tampered = parts[0] + ":" + Base64.getEncoder().encodeToString(ct);

            assertThatThrownBy(() -> cipher.decrypt(tampered)).isInstanceOf(GeneralSecurityException.class);
        }

        @Test
        @DisplayName("another key cannot decrypt")
        void wrongKey() {
            String sealed = new TokenCipher(new VaultProperties(OTHER_KEY)).encrypt("AIzaSy-test-key");

            assertThatThrownBy(() -> cipher.decrypt(sealed)).isInstanceOf(GeneralSecurityException.class);
        }

        @Test
        @DisplayName("malformed input is a security failure, not a crash")
        void malformed() {
            assertThatThrownBy(() -> cipher.decrypt("no-separator")).isInstanceOf(GeneralSecurityException.class);
            assertThatThrownBy(() -> cipher.decrypt("!!!:???")).isInstanceOf(GeneralSecurityException.class);
            assertThatThrownBy(() -> cipher.decrypt("AAAA:AAAA")).isInstanceOf(GeneralSecurityException.class);
            assertThatThrownBy(() -> cipher.decrypt(null)).isInstanceOf(GeneralSecurityException.class);
        }
    }

    @Test
    @DisplayName("startup fails without a valid 256-bit hex key")
    void invalidKey() {
        assertThatThrownBy(() -> new TokenCipher(new VaultProperties(null)))
                .isInstanceOf(IllegalStateException.class).hasMessageContaining("not set");
        assertThatThrownBy(() -> new TokenCipher(new VaultProperties("not-hex")))
                .isInstanceOf(IllegalStateException.class).hasMessageContaining("hex");
        assertThatThrownBy(() -> new TokenCipher(new VaultProperties("00112233")))
                .isInstanceOf(IllegalStateException.class).hasMessageContaining("32 bytes");
    }
}
