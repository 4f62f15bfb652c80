package dev.quorum.infrastructure.crypto;

import dev.quorum.config.VaultProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM for stored API keys.
 *
 * <p>Format: {@code base64(iv):base64(ciphertext+tag)}, 96-bit random IV per value,
 * 128-bit tag. The key is read once from {@code quorum.vault.encryption-key}; a
 * missing or malformed key fails startup.
 */
@Component
public class TokenCipher {

    private static final Logger log = LoggerFactory.getLogger(TokenCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public TokenCipher(VaultProperties props) {
        this.secretKey = parseKey(props.encryptionKey());
        log.info("Token cipher initialized with AES-256-GCM");
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Nothing to encrypt");
        }
        byte[] plaintextBytes = plaintext.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintextBytes);
            return Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        } finally {
            Arrays.fill(plaintextBytes, (byte) 0);
        }
    }

    /**
     * Decrypts into a char array the caller owns and must wipe.
     *
     * @throws GeneralSecurityException on malformed input, wrong key or a failed tag check
     */
    public char[] decrypt(String encrypted) throws GeneralSecurityException {
        String[] parts = encrypted == null ? new String[0] : encrypted.split(":", 2);
        if (parts.length != 2) {
            throw new GeneralSecurityException("Invalid ciphertext format");
        }
        byte[] iv;
        byte[] ciphertext;
        try {
            iv = Base64.getDecoder().decode(parts[0]);
            ciphertext = Base64.getDecoder().decode(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Ciphertext is not valid base64", e);
        }
        if (iv.length != GCM_IV_LENGTH) {
            throw new GeneralSecurityException("Unexpected IV length " + iv.length);
        }

        Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        byte[] plaintextBytes = cipher.doFinal(ciphertext);
        try {
            CharBuffer chars = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(plaintextBytes));
            char[] result = Arrays.copyOfRange(chars.array(), chars.position(), chars.limit());
            Arrays.fill(chars.array(), '\0');
            return result;
        } finally {
            Arrays.fill(plaintextBytes, (byte) 0);
        }
    }

    private static SecretKey parseKey(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalStateException("quorum.vault.encryption-key is not set");
        }
        byte[] keyBytes;
        try {
            keyBytes = HexFormat.of().parseHex(hex.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("quorum.vault.encryption-key must be hex-encoded");
        }
        if (keyBytes.length != 32) {
            throw new IllegalStateException(
                    "quorum.vault.encryption-key must be 32 bytes (256 bits), got " + keyBytes.length);
        }
        return new SecretKeySpec(keyBytes, "AES");
    }
}
