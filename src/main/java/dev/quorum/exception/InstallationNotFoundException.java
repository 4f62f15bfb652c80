package dev.quorum.exception;

public class InstallationNotFoundException extends RuntimeException {

    public InstallationNotFoundException(long externalInstallationId) {
        super("Installation not found: " + externalInstallationId);
    }
}
