package io.fullerstack.components.security;

/**
 * Per-component security overview produced by {@link SecureComponents#securityReport()}.
 */
public record SecurityReport(
    String name,
    boolean hasSignature,
    boolean signatureVerified,
    boolean approved,
    boolean hasSupplyChain,
    boolean supplyChainVerified,
    ModulePermissions permissions,
    boolean sandboxEnabled
) {
}
