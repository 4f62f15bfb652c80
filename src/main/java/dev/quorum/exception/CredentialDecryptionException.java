package dev.quorum.exception;

/**
 * Stored ciphertext exists but does not decrypt: corrupted, or written under another vault key.
 */
public class CredentialDecryptionException extends CredentialException {

    public CredentialDecryptionException(long externalInstallationId, Throwable cause) {
        super(externalInstallationId, "Stored API key for installation " + externalInstallationId
                + " could not be decrypted", cause);
    }

    @Override
    public String userMessage() {
        return "The stored API key could not be decrypted. Re-enter the API key in the installation settings.";
    }
}
