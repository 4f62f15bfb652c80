package dev.quorum.infrastructure.crypto;

import java.util.Arrays;

/**
 * A decrypted model API key, valid for one run.
 *
 * <p>Open it with try-with-resources: {@link #close()} wipes the backing array and
 * every later {@link #reveal()} throws. Never serialized, never logged.
 */
public final class ApiCredential implements AutoCloseable {

    private final long externalInstallationId;
    private final char[] secret;
    private volatile boolean closed;

    public ApiCredential(long externalInstallationId, char[] secret) {
        this.externalInstallationId = externalInstallationId;
        this.secret = secret;
    }

    /**
     * The key as a String for the HTTP client. Callers must not retain it past the run.
     */
    public String reveal() {
        if (closed) throw new IllegalStateException("Credential already released");
        return new String(secret);
    }

    public long externalInstallationId() {
        return externalInstallationId;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        Arrays.fill(secret, '\0');
    }

    @Override
    public String toString() {
        return "ApiCredential[installation=" + externalInstallationId + ", secret=****]";
    }
}
