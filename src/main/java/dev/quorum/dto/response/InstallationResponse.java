package dev.quorum.dto.response;

import dev.quorum.domain.enums.OwnerType;

import java.time.Instant;
import java.util.Map;

/**
 * Installation as the config UI sees it. Only the presence of the API key is exposed.
 */
public record InstallationResponse(
        long installationId, String ownerLogin, OwnerType ownerType, boolean enabled,
        Map<String, Boolean> settings, boolean hasApiKey, Instant createdAt, Instant updatedAt
) {}
