package dev.quorum.controller;

import dev.quorum.config.SecurityConfig;
import dev.quorum.domain.enums.OwnerType;
import dev.quorum.dto.response.InstallationResponse;
import dev.quorum.dto.response.ReviewStatsResponse;
import dev.quorum.exception.InstallationNotFoundException;
import dev.quorum.service.InstallationService;
import dev.quorum.service.ReviewQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InstallationController.class)
@Import(SecurityConfig.class)
class InstallationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private InstallationService installationService;

    @MockitoBean
    private ReviewQueryService queryService;

    private static InstallationResponse response(boolean hasApiKey) {
        Map<String, Boolean> settings = Map.of("security", true, "logic", true, "performance", true,
                "style", false, "autoApprove", false);
        return new InstallationResponse(42L, "octo", OwnerType.USER, true, settings, hasApiKey,
                Instant.parse("2025-03-01T12:00:00Z"), Instant.parse("2025-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("requires authentication")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/installations/42"))
                .andExpect(status().isUnauthorized());
    }

    @Nested
    @DisplayName("Authenticated")
    @WithMockUser
    class Authenticated {

        @Test
        @DisplayName("shows whether a key exists but never the key")
        void getInstallation() throws Exception {
            when(installationService.get(42L)).thenReturn(response(true));

            mockMvc.perform(get("/installations/42"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.hasApiKey").value(true))
                    .andExpect(jsonPath("$.settings.style").value(false))
                    .andExpect(jsonPath("$.apiKey").doesNotExist())
                    .andExpect(jsonPath("$.encryptedApiKey").doesNotExist());
        }

        @Test
        @DisplayName("unknown installation is 404")
        void notFound() throws Exception {
            when(installationService.get(7L)).thenThrow(new InstallationNotFoundException(7L));

            mockMvc.perform(get("/installations/7"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("unknown settings key is 400")
        void unknownSettingsKey() throws Exception {
            when(installationService.updateSettings(eq(42L), anyMap()))
                    .thenThrow(new IllegalArgumentException("Unknown settings keys: [review_style]"));

            mockMvc.perform(put("/installations/42/settings")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"review_style\": true}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Unknown settings keys: [review_style]"));
        }

        @Test
        @DisplayName("settings update passes the flags through")
        void updateSettings() throws Exception {
            when(installationService.updateSettings(42L, Map.of("style", false))).thenReturn(response(false));

            mockMvc.perform(put("/installations/42/settings")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"style\": false}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.settings.style").value(false));
        }

        @Test
        @DisplayName("stores an API key and echoes only its presence")
        void storeApiKey() throws Exception {
            when(installationService.storeApiKey(42L, "AIzaSy-secret")).thenReturn(response(true));

            mockMvc.perform(put("/installations/42/api-key")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"apiKey\": \"AIzaSy-secret\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.hasApiKey").value(true))
                    .andExpect(jsonPath("$.apiKey").doesNotExist());
        }

        @Test
        @DisplayName("blank API key is 400 and never reaches the service")
        void blankApiKey() throws Exception {
            mockMvc.perform(put("/installations/42/api-key")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"apiKey\": \"  \"}"))
                    .andExpect(status().isBadRequest());

            verify(installationService, never()).storeApiKey(eq(42L), anyString());
        }

        @Test
        @DisplayName("deleting the key returns the installation without one")
        void clearApiKey() throws Exception {
            when(installationService.clearApiKey(42L)).thenReturn(response(false));

            mockMvc.perform(delete("/installations/42/api-key"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.hasApiKey").value(false));
        }

        @Test
        @DisplayName("stats default to a 30-day window")
        void stats() throws Exception {
            when(queryService.stats(42L, 30)).thenReturn(new ReviewStatsResponse(42L, 30, 4, 10, 2.5));

            mockMvc.perform(get("/installations/42/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalReviews").value(4))
                    .andExpect(jsonPath("$.avgIssuesPerReview").value(2.5));
        }
    }
}
