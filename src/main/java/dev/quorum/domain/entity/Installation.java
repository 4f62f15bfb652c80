package dev.quorum.domain.entity;

import dev.quorum.domain.enums.OwnerType;
import dev.quorum.domain.valueobject.ReviewSettings;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A connected repository owner: settings plus the encrypted model API key.
 * Soft-disabled on uninstall so review history survives.
 */
@Entity
@Table(name = "installations")
public class Installation {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "external_installation_id", unique = true, nullable = false)
    private Long externalInstallationId;

    @Column(name = "owner_login", nullable = false)
    private String ownerLogin;

    @Enumerated(EnumType.STRING)
    @Column(name = "owner_type", nullable = false, length = 20)
    private OwnerType ownerType;

    @Column(name = "encrypted_api_key", columnDefinition = "text")
    private String encryptedApiKey;

    @Column(nullable = false)
    private boolean enabled;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings", columnDefinition = "jsonb", nullable = false)
    private Map<String, Boolean> settings;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Installation() {
    }

    public static Installation register(long externalInstallationId, String ownerLogin, OwnerType ownerType) {
        Installation i = new Installation();
        i.id = UUID.randomUUID();
        i.externalInstallationId = externalInstallationId;
        i.ownerLogin = ownerLogin;
        i.ownerType = ownerType != null ? ownerType : OwnerType.USER;
        i.enabled = true;
        i.settings = ReviewSettings.defaults().toMap();
        i.createdAt = Instant.now();
        i.updatedAt = i.createdAt;
        return i;
    }

    public ReviewSettings reviewSettings() {
        return ReviewSettings.fromMap(settings);
    }

    public void updateSettings(ReviewSettings newSettings) {
        this.settings = newSettings.toMap();
        touch();
    }

    public void storeEncryptedApiKey(String ciphertext) {
        this.encryptedApiKey = ciphertext;
        touch();
    }

    public void clearApiKey() {
        this.encryptedApiKey = null;
        touch();
    }

    public boolean hasApiKey() {
        return encryptedApiKey != null && !encryptedApiKey.isBlank();
    }

    public void enable() {
        this.enabled = true;
        touch();
    }

    public void disable() {
        this.enabled = false;
        touch();
    }

    public void updateOwner(String login, OwnerType type) {
        if (login != null && !login.isBlank()) this.ownerLogin = login;
        if (type != null) this.ownerType = type;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public Long getExternalInstallationId() {
        return externalInstallationId;
    }

    public String getOwnerLogin() {
        return ownerLogin;
    }

    public OwnerType getOwnerType() {
        return ownerType;
    }

    public String getEncryptedApiKey() {
        return encryptedApiKey;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
