package dev.quorum.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import dev.quorum.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.security.interfaces.RSAPrivateKey;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GitHub App authentication: signs an app JWT with the App's private key,
 * exchanges it for an installation token and caches that token until five
 * minutes before it expires.
 *
 * <p>This token talks to GitHub only. The model API key is a separate,
 * per-installation secret handled by the credential vault.
 */
@Component
public class GitHubTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(GitHubTokenProvider.class);
    private static final long REFRESH_MARGIN_SECONDS = 300;

    private final GitHubProperties properties;
    private final WebClient webClient;
    private final Map<Long, CachedToken> cache = new ConcurrentHashMap<>();
    private volatile RSAPrivateKey privateKey;

    public GitHubTokenProvider(GitHubProperties properties, WebClient.Builder builder) {
        this.properties = properties;
        this.webClient = builder.baseUrl(properties.apiUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .build();
    }

    public String getInstallationToken(long installationId) {
        CachedToken cached = cache.get(installationId);
        if (cached != null && cached.expiresAt().isAfter(Instant.now().plusSeconds(REFRESH_MARGIN_SECONDS))) {
            return cached.token();
        }

        TokenResponse response = webClient.post()
                .uri("/app/installations/{installationId}/access_tokens", installationId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                .retrieve()
                .bodyToMono(TokenResponse.class)
                .block();

        if (response == null || response.token() == null) {
            throw new IllegalStateException("No installation token returned for installation " + installationId);
        }
        Instant expiresAt = response.expiresAt() != null ? response.expiresAt() : Instant.now().plusSeconds(3600);
        cache.put(installationId, new CachedToken(response.token(), expiresAt));
        log.info("Obtained installation token for installation {} (expires {})", installationId, expiresAt);
        return response.token();
    }

    String appJwt() {
        Instant now = Instant.now();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(String.valueOf(properties.appId()))
                .issueTime(Date.from(now.minusSeconds(60)))
                .expirationTime(Date.from(now.plusSeconds(540)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
        try {
            jwt.sign(new RSASSASigner(signingKey()));
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign GitHub App JWT", e);
        }
        return jwt.serialize();
    }

    private RSAPrivateKey signingKey() {
        RSAPrivateKey key = privateKey;
        if (key == null) {
            String pem = properties.privateKey();
            if (pem == null || pem.isBlank()) {
                throw new IllegalStateException("quorum.github.private-key is not configured");
            }
            key = PemPrivateKeys.parse(pem);
            privateKey = key;
        }
        return key;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(String token, @JsonProperty("expires_at") Instant expiresAt) {}

    private record CachedToken(String token, Instant expiresAt) {}
}
