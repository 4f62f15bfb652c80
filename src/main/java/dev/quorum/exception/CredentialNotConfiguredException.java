package dev.quorum.exception;

public class CredentialNotConfiguredException extends CredentialException {

    public CredentialNotConfiguredException(long externalInstallationId) {
        super(externalInstallationId, "No API key configured for installation " + externalInstallationId, null);
    }

    @Override
    public String userMessage() {
        return "No API key configured. Add a model API key in the installation settings to enable reviews.";
    }
}
