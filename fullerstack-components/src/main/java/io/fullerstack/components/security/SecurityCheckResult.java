package io.fullerstack.components.security;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link SecurityValidator#comprehensiveCheck(SecurityProfile)}.
 *
 * @param riskLevel highest severity found
 * @param issues    every finding, in check order
 * @param checkedAt when the check ran
 */
public record SecurityCheckResult(RiskLevel riskLevel, List<SecurityIssue> issues, Instant checkedAt) {

    public SecurityCheckResult {
        Objects.requireNonNull(riskLevel, "riskLevel");
        issues = List.copyOf(issues);
        Objects.requireNonNull(checkedAt, "checkedAt");
    }

    /**
     * @return true when no issue was found
     */
    public boolean isSecure() {
        return issues.isEmpty();
    }

    /**
     * @return true for MEDIUM risk and above
     */
    public boolean hasSecurityRisk() {
        return riskLevel.compareTo(RiskLevel.MEDIUM) >= 0;
    }

    public List<SecurityIssue> criticalIssues() {
        return issues.stream()
            .filter(issue -> issue.severity() == Severity.CRITICAL)
            .toList();
    }

    /**
     * @return HIGH and CRITICAL issues
     */
    public List<SecurityIssue> highSeverityIssues() {
        return issues.stream()
            .filter(issue -> issue.severity().compareTo(Severity.HIGH) >= 0)
            .toList();
    }

    public String summary() {
        return "Security check " + (isSecure() ? "PASSED" : "FAILED") + ": "
            + issues.size() + " issues, risk level: " + riskLevel;
    }
}
