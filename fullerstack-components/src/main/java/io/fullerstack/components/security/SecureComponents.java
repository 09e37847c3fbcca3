package io.fullerstack.components.security;

import io.fullerstack.components.registry.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Security policy wrapper over a {@link ComponentRegistry}.
 * <p>
 * Reads {@link SecurityProfile}s from component metadata and gates creation on them. All
 * state lives in the wrapped registry; this class adds no locking of its own.
 * <p>
 * <b>Usage:</b>
 * <pre>
 * SecureComponents secure = new SecureComponents(registry);
 * secure.registerSecure("payments", "plugin", factory, signature, permissions, supplyChain);
 *
 * // after review: re-register with an approved profile (REPLACE registry)
 * ComponentHandle handle = secure.createSecure("payments");
 * </pre>
 */
public final class SecureComponents {

    private static final Logger logger = LoggerFactory.getLogger(SecureComponents.class);

    private final ComponentRegistry registry;
    private final SecurityValidator validator;

    /**
     * Wrapper validating with the registry's settings and the system clock.
     */
    public SecureComponents(ComponentRegistry registry) {
        this(registry, new SecurityValidator(registry.settings(), Clock.systemUTC()));
    }

    public SecureComponents(ComponentRegistry registry, SecurityValidator validator) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Register a component with security descriptors. Review starts as PENDING and the default
     * sandbox applies.
     *
     * @param signature   code signature, or null if unsigned
     * @param permissions granted access
     * @param supplyChain build provenance, or null if unknown
     */
    public void registerSecure(
        String name,
        String moduleType,
        ComponentFactory factory,
        ModuleSignature signature,
        ModulePermissions permissions,
        SupplyChainInfo supplyChain) {

        SecurityProfile profile = SecurityProfile.defaults()
            .withSignature(signature)
            .withPermissions(permissions)
            .withSupplyChain(supplyChain);
        registry.register(name, moduleType, factory, ComponentMetadata.defaults().withSecurity(profile));
        logger.info("Registered secure module: {} (type: {})", name, moduleType);
    }

    /**
     * Record a review decision for a registered component. Its factory and the rest of its
     * security profile are kept.
     *
     * @throws ComponentNotFoundException if nothing is registered under the name
     */
    public void updateReviewStatus(String name, ReviewStatus status) {
        Objects.requireNonNull(status, "status");
        registry.replaceMetadata(name, metadata ->
            metadata.withSecurity(metadata.security().withReviewStatus(status)));
        logger.info("Updated review status for module: {}", name);
    }

    public boolean verifySignature(String name) {
        return validator.verifySignature(profile(name));
    }

    public boolean checkPermission(String name, String permission) {
        return validator.checkPermission(profile(name), permission);
    }

    public boolean isApproved(String name) {
        return validator.isApproved(profile(name));
    }

    public boolean verifySupplyChain(String name) {
        return validator.verifySupplyChain(profile(name));
    }

    /**
     * Create a component only if its signature is valid, its review is approved and its supply
     * chain is verified, in that order.
     *
     * @param name component name
     * @return handle owning the new instance
     * @throws ComponentNotFoundException  if nothing is registered under the name
     * @throws SecurityViolationException  if a check fails; the factory is not run
     * @throws FactoryFailedException      if the factory fails
     */
    public ComponentHandle createSecure(String name) {
        SecurityProfile profile = profile(name);

        if (!validator.verifySignature(profile)) {
            throw violation(name, "signature", "Module signature verification failed: " + name);
        }
        if (!validator.isApproved(profile)) {
            throw violation(name, "review", "Module not approved: " + name);
        }
        if (!validator.verifySupplyChain(profile)) {
            throw violation(name, "supply_chain", "Supply chain verification failed: " + name);
        }

        if (profile.sandbox().enabled()) {
            logger.info("Creating sandboxed module: {} with {}", name, profile.sandbox());
        }
        return registry.create(name);
    }

    /**
     * Secure creation narrowed to a capability.
     */
    public <T> T createSecure(String name, Class<T> type) {
        return createSecure(name).as(type);
    }

    /**
     * @return report per registered name, in lexical order
     */
    public Map<String, SecurityReport> securityReport() {
        Map<String, SecurityReport> report = new TreeMap<>();
        for (ComponentDescriptor descriptor : registry.descriptors()) {
            SecurityProfile profile = descriptor.metadata().security();
            report.put(descriptor.name(), new SecurityReport(
                descriptor.name(),
                profile.signature().isPresent(),
                validator.verifySignature(profile),
                validator.isApproved(profile),
                profile.supplyChain().isPresent(),
                validator.verifySupplyChain(profile),
                profile.permissions(),
                profile.sandbox().enabled()));
        }
        return Collections.unmodifiableMap(report);
    }

    /**
     * @return full check per registered name, in lexical order
     */
    public Map<String, SecurityCheckResult> securityAudit() {
        Map<String, SecurityCheckResult> audit = new TreeMap<>();
        for (ComponentDescriptor descriptor : registry.descriptors()) {
            SecurityCheckResult result = validator.comprehensiveCheck(descriptor.metadata().security());
            if (result.hasSecurityRisk()) {
                logger.warn("Module {}: {}", descriptor.name(), result.summary());
            }
            audit.put(descriptor.name(), result);
        }
        return Collections.unmodifiableMap(audit);
    }

    public ComponentRegistry registry() {
        return registry;
    }

    private SecurityProfile profile(String name) {
        return registry.getMetadata(name)
            .map(ComponentMetadata::security)
            .orElseThrow(() -> new ComponentNotFoundException(name));
    }

    private SecurityViolationException violation(String name, String check, String message) {
        logger.warn("Refused to create module {}: {} check failed", name, check);
        return new SecurityViolationException(name, check, message);
    }
}
