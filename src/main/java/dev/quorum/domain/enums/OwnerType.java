package dev.quorum.domain.enums;

public enum OwnerType {
    USER, ORGANIZATION;

    public static OwnerType fromGitHub(String type) {
        return "Organization".equalsIgnoreCase(type) ? ORGANIZATION : USER;
    }
}
