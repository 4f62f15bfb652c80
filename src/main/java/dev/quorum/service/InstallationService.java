package dev.quorum.service;

import dev.quorum.domain.entity.Installation;
import dev.quorum.domain.enums.OwnerType;
import dev.quorum.domain.valueobject.ReviewSettings;
import dev.quorum.dto.response.InstallationResponse;
import dev.quorum.exception.InstallationNotFoundException;
import dev.quorum.infrastructure.crypto.CredentialVault;
import dev.quorum.repository.InstallationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Installation lifecycle (driven by installation webhooks) and the config API.
 * Installations are never deleted, only disabled, so review history survives.
 */
@Service
@Transactional
public class InstallationService {

    private static final Logger log = LoggerFactory.getLogger(InstallationService.class);

    private final InstallationRepository repository;
    private final CredentialVault vault;

    public InstallationService(InstallationRepository repository, CredentialVault vault) {
        this.repository = repository;
        this.vault = vault;
    }

    // ── Webhook side ─────────────────────────────────────────────

    public Installation registerOrReactivate(long externalId, String ownerLogin, OwnerType ownerType) {
        return repository.findByExternalInstallationId(externalId)
                .map(existing -> {
                    existing.updateOwner(ownerLogin, ownerType);
                    existing.enable();
                    log.info("Installation {} re-registered for {}", externalId, existing.getOwnerLogin());
                    return existing;
                })
                .orElseGet(() -> {
                    Installation created = repository.save(Installation.register(externalId,
                            ownerLogin != null ? ownerLogin : "unknown", ownerType));
                    log.info("Installation {} registered for {}", externalId, created.getOwnerLogin());
                    return created;
                });
    }

    /**
     * Installation for an incoming pull request; one that never announced itself is
     * registered on the spot so its runs have an owner row.
     */
    public Installation resolveForPullRequest(long externalId, String ownerLogin, OwnerType ownerType) {
        return repository.findByExternalInstallationId(externalId)
                .orElseGet(() -> {
                    log.info("Pull request from unregistered installation {}, registering", externalId);
                    return repository.save(Installation.register(externalId,
                            ownerLogin != null ? ownerLogin : "unknown", ownerType));
                });
    }

    public void setEnabled(long externalId, boolean enabled) {
        repository.findByExternalInstallationId(externalId).ifPresentOrElse(
                installation -> {
                    if (enabled) installation.enable();
                    else installation.disable();
                    log.info("Installation {} {}", externalId, enabled ? "enabled" : "disabled");
                },
                () -> log.warn("Lifecycle event for unknown installation {} ignored", externalId));
    }

    // ── Config API ───────────────────────────────────────────────

    @Transactional(readOnly = true)
    public InstallationResponse get(long externalId) {
        return toResponse(load(externalId));
    }

    public InstallationResponse updateSettings(long externalId, Map<String, Boolean> flags) {
        ReviewSettings settings = ReviewSettings.fromUserInput(flags);
        Installation installation = load(externalId);
        installation.updateSettings(settings);
        log.info("Settings updated for installation {}: {}", externalId, settings);
        return toResponse(installation);
    }

    public InstallationResponse storeApiKey(long externalId, String plaintextKey) {
        if (plaintextKey == null || plaintextKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        Installation installation = load(externalId);
        installation.storeEncryptedApiKey(vault.seal(plaintextKey.trim()));
        log.info("API key stored for installation {}", externalId);
        return toResponse(installation);
    }

    public InstallationResponse clearApiKey(long externalId) {
        Installation installation = load(externalId);
        installation.clearApiKey();
        log.info("API key cleared for installation {}", externalId);
        return toResponse(installation);
    }

    private Installation load(long externalId) {
        return repository.findByExternalInstallationId(externalId)
                .orElseThrow(() -> new InstallationNotFoundException(externalId));
    }

    private InstallationResponse toResponse(Installation i) {
        return new InstallationResponse(i.getExternalInstallationId(), i.getOwnerLogin(), i.getOwnerType(),
                i.isEnabled(), i.reviewSettings().toMap(), i.hasApiKey(), i.getCreatedAt(), i.getUpdatedAt());
    }
}
