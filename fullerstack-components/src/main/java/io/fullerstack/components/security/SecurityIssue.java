package io.fullerstack.components.security;

import java.util.Objects;

/**
 * One finding of a security check.
 *
 * @param severity how bad it is
 * @param message  description
 * @param area     profile part that failed: signature, review, supply_chain or permissions
 */
public record SecurityIssue(Severity severity, String message, String area) {

    public SecurityIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(area, "area");
    }
}
