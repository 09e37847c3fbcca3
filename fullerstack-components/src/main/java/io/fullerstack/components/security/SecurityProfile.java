package io.fullerstack.components.security;

import java.util.Objects;
import java.util.Optional;

/**
 * Security descriptors carried in {@link io.fullerstack.components.registry.ComponentMetadata}.
 * <p>
 * The core registry stores the profile without looking at it; {@link SecurityValidator} and
 * {@link SecureComponents} interpret it.
 *
 * @param signature    code signature, if signed
 * @param permissions  granted access and limits
 * @param reviewStatus code review state
 * @param supplyChain  build provenance, if known
 * @param sandbox      requested isolation
 */
public record SecurityProfile(
    Optional<ModuleSignature> signature,
    ModulePermissions permissions,
    ReviewStatus reviewStatus,
    Optional<SupplyChainInfo> supplyChain,
    SandboxConfig sandbox
) {

    private static final SecurityProfile DEFAULTS = new SecurityProfile(
        Optional.empty(), ModulePermissions.defaults(), ReviewStatus.pending(), Optional.empty(),
        SandboxConfig.defaults());

    public SecurityProfile {
        signature = signature != null ? signature : Optional.empty();
        supplyChain = supplyChain != null ? supplyChain : Optional.empty();
        Objects.requireNonNull(permissions, "permissions");
        Objects.requireNonNull(reviewStatus, "reviewStatus");
        Objects.requireNonNull(sandbox, "sandbox");
    }

    /**
     * Unsigned, no permissions, review pending, no provenance, default sandbox.
     */
    public static SecurityProfile defaults() {
        return DEFAULTS;
    }

    public SecurityProfile withSignature(ModuleSignature value) {
        return new SecurityProfile(Optional.ofNullable(value), permissions, reviewStatus, supplyChain, sandbox);
    }

    public SecurityProfile withPermissions(ModulePermissions value) {
        return new SecurityProfile(signature, value, reviewStatus, supplyChain, sandbox);
    }

    public SecurityProfile withReviewStatus(ReviewStatus value) {
        return new SecurityProfile(signature, permissions, value, supplyChain, sandbox);
    }

    public SecurityProfile withSupplyChain(SupplyChainInfo value) {
        return new SecurityProfile(signature, permissions, reviewStatus, Optional.ofNullable(value), sandbox);
    }

    public SecurityProfile withSandbox(SandboxConfig value) {
        return new SecurityProfile(signature, permissions, reviewStatus, supplyChain, value);
    }

    public String summary() {
        return "signature: " + signature.isPresent()
            + ", approved: " + reviewStatus.isApproved()
            + ", supply_chain: " + supplyChain.isPresent()
            + ", sandbox: " + sandbox.enabled();
    }
}
