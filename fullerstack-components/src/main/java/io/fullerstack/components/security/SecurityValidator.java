package io.fullerstack.components.security;

import io.fullerstack.components.config.RegistrySettings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a {@link SecurityProfile} against signature, review, provenance and permission rules.
 * <p>
 * <b>Rules:</b>
 * <ul>
 *   <li>Signature: present, not older than the configured expiry, not dated in the future,
 *       using the configured algorithm, with non-empty signature and public key</li>
 *   <li>Review: state is APPROVED</li>
 *   <li>Supply chain: present, non-empty source URL and commit hash, build time not in the future</li>
 *   <li>Permissions: {@code system_access} requires an enabled sandbox</li>
 * </ul>
 * Signature bytes are not cryptographically verified; only their presence and envelope are.
 * <p>
 * Time comes from the injected {@link Clock}, so tests can pin it.
 */
public final class SecurityValidator {

    private final Duration signatureExpiry;
    private final String signatureAlgorithm;
    private final Clock clock;

    public SecurityValidator() {
        this(RegistrySettings.defaults(), Clock.systemUTC());
    }

    /**
     * @param settings source of the signature expiry and algorithm
     * @param clock    time source
     */
    public SecurityValidator(RegistrySettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        this.signatureExpiry = Duration.ofSeconds(settings.signatureExpirySeconds());
        this.signatureAlgorithm = settings.signatureAlgorithm();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean verifySignature(SecurityProfile profile) {
        return profile.signature()
            .map(this::isValid)
            .orElse(false);
    }

    private boolean isValid(ModuleSignature signature) {
        Instant now = clock.instant();
        if (signature.signedAt().isAfter(now)) {
            return false;
        }
        if (Duration.between(signature.signedAt(), now).compareTo(signatureExpiry) > 0) {
            return false;
        }
        if (!signatureAlgorithm.equals(signature.algorithm())) {
            return false;
        }
        return !signature.signature().isEmpty() && !signature.publicKey().isEmpty();
    }

    /**
     * @param profile    profile to inspect
     * @param permission one of the names in {@link ModulePermissions}
     * @return whether granted; unknown names are never granted
     */
    public boolean checkPermission(SecurityProfile profile, String permission) {
        return profile.permissions().allows(permission);
    }

    public boolean isApproved(SecurityProfile profile) {
        return profile.reviewStatus().isApproved();
    }

    public boolean verifySupplyChain(SecurityProfile profile) {
        return profile.supplyChain()
            .map(chain -> !chain.sourceUrl().isEmpty()
                && !chain.commitHash().isEmpty()
                && !chain.builtAt().isAfter(clock.instant()))
            .orElse(false);
    }

    /**
     * Runs every rule and collects the failures.
     *
     * @param profile profile to inspect
     * @return issues found and the resulting risk level
     */
    public SecurityCheckResult comprehensiveCheck(SecurityProfile profile) {
        List<SecurityIssue> issues = new ArrayList<>();

        if (!verifySignature(profile)) {
            issues.add(new SecurityIssue(Severity.HIGH, "Module signature verification failed", "signature"));
        }
        if (!isApproved(profile)) {
            issues.add(new SecurityIssue(Severity.MEDIUM, "Module not approved by code review", "review"));
        }
        if (!verifySupplyChain(profile)) {
            issues.add(new SecurityIssue(Severity.MEDIUM, "Supply chain verification failed", "supply_chain"));
        }
        if (profile.permissions().systemAccess() && !profile.sandbox().enabled()) {
            issues.add(new SecurityIssue(Severity.HIGH, "System access granted without sandboxing", "permissions"));
        }

        return new SecurityCheckResult(RiskLevel.of(issues), issues, clock.instant());
    }
}
