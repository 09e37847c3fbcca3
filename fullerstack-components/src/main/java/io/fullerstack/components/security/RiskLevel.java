package io.fullerstack.components.security;

import java.util.Collection;

/**
 * Overall risk of a component: the highest issue severity, or {@link #NONE}.
 */
public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static RiskLevel of(Collection<SecurityIssue> issues) {
        RiskLevel level = NONE;
        for (SecurityIssue issue : issues) {
            RiskLevel candidate = RiskLevel.valueOf(issue.severity().name());
            if (candidate.compareTo(level) > 0) {
                level = candidate;
            }
        }
        return level;
    }
}
