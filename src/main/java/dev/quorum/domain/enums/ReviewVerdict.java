package dev.quorum.domain.enums;

/**
 * GitHub pull request review event used when posting the report.
 */
public enum ReviewVerdict {
    APPROVE, COMMENT
}
