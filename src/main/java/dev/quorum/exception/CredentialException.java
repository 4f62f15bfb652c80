package dev.quorum.exception;

/**
 * An installation's model credential could not be produced for a run.
 * Fatal for the run, never for the webhook response.
 */
public abstract class CredentialException extends RuntimeException {

    private final long externalInstallationId;

    protected CredentialException(long externalInstallationId, String message, Throwable cause) {
        super(message, cause);
        this.externalInstallationId = externalInstallationId;
    }

    public long getExternalInstallationId() {
        return externalInstallationId;
    }

    /** Text stored on the failed Review and shown to the pull request author. */
    public abstract String userMessage();
}
