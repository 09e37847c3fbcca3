package io.fullerstack.components.security;

/**
 * Severity of a single {@link SecurityIssue}, lowest first.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
