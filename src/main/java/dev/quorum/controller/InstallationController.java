package dev.quorum.controller;

import dev.quorum.dto.request.ApiKeyRequest;
import dev.quorum.dto.request.SettingsUpdateRequest;
import dev.quorum.dto.response.InstallationResponse;
import dev.quorum.dto.response.ReviewStatsResponse;
import dev.quorum.service.InstallationService;
import dev.quorum.service.ReviewQueryService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Backing API for the installation config UI. The API key is write-only:
 * responses carry {@code hasApiKey}, never the key or its ciphertext.
 */
@RestController
@RequestMapping("/installations/{installationId}")
public class InstallationController {
    private final InstallationService installationService;
    private final ReviewQueryService queryService;

    public InstallationController(InstallationService installationService, ReviewQueryService queryService) {
        this.installationService = installationService;
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<InstallationResponse> get(@PathVariable long installationId) {
        return ResponseEntity.ok(installationService.get(installationId));
    }

    @PutMapping("/settings")
    public ResponseEntity<InstallationResponse> updateSettings(@PathVariable long installationId,
                                                               @RequestBody SettingsUpdateRequest request) {
        return ResponseEntity.ok(installationService.updateSettings(installationId, request.flags()));
    }

    @PutMapping("/api-key")
    public ResponseEntity<InstallationResponse> storeApiKey(@PathVariable long installationId,
                                                            @Valid @RequestBody ApiKeyRequest request) {
        return ResponseEntity.ok(installationService.storeApiKey(installationId, request.apiKey()));
    }

    @DeleteMapping("/api-key")
    public ResponseEntity<InstallationResponse> clearApiKey(@PathVariable long installationId) {
        return ResponseEntity.ok(installationService.clearApiKey(installationId));
    }

    @GetMapping("/stats")
    public ResponseEntity<ReviewStatsResponse> stats(@PathVariable long installationId,
                                                     @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(queryService.stats(installationId, days));
    }
}
