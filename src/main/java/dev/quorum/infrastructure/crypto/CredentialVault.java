package dev.quorum.infrastructure.crypto;

import dev.quorum.domain.entity.Installation;
import dev.quorum.exception.CredentialDecryptionException;
import dev.quorum.exception.CredentialNotConfiguredException;
import dev.quorum.repository.InstallationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.security.GeneralSecurityException;

/**
 * Turns an installation's stored ciphertext into a run-scoped {@link ApiCredential}.
 * Holds no per-request state.
 */
@Component
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private final InstallationRepository installations;
    private final TokenCipher cipher;

    public CredentialVault(InstallationRepository installations, TokenCipher cipher) {
        this.installations = installations;
        this.cipher = cipher;
    }

    /**
     * @throws CredentialNotConfiguredException no installation row, or no key stored
     * @throws CredentialDecryptionException    ciphertext present but undecryptable
     */
    @Transactional(readOnly = true)
    public ApiCredential resolve(long externalInstallationId) {
        String ciphertext = installations.findByExternalInstallationId(externalInstallationId)
                .filter(Installation::hasApiKey)
                .map(Installation::getEncryptedApiKey)
                .orElseThrow(() -> new CredentialNotConfiguredException(externalInstallationId));
        try {
            return new ApiCredential(externalInstallationId, cipher.decrypt(ciphertext));
        } catch (GeneralSecurityException e) {
            log.warn("API key for installation {} failed to decrypt: {}", externalInstallationId,
                    e.getClass().getSimpleName());
            throw new CredentialDecryptionException(externalInstallationId, e);
        }
    }

    public String seal(String plaintextKey) {
        return cipher.encrypt(plaintextKey);
    }
}
