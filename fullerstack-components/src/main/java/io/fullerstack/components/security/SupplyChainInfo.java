package io.fullerstack.components.security;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Provenance of a component build.
 *
 * @param sourceUrl          source repository URL
 * @param commitHash         commit the build was made from
 * @param builtAt            build time
 * @param dependencies       dependency name to version
 * @param buildEnvironment   free-form build environment description
 * @param verifierSignature  signature of the party that verified the build, or null
 */
public record SupplyChainInfo(
    String sourceUrl,
    String commitHash,
    Instant builtAt,
    Map<String, String> dependencies,
    String buildEnvironment,
    String verifierSignature
) {

    public SupplyChainInfo {
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        Objects.requireNonNull(commitHash, "commitHash");
        Objects.requireNonNull(builtAt, "builtAt");
        dependencies = dependencies != null ? Map.copyOf(dependencies) : Map.of();
        buildEnvironment = buildEnvironment != null ? buildEnvironment : "";
    }

    public static SupplyChainInfo of(String sourceUrl, String commitHash, Instant builtAt) {
        return new SupplyChainInfo(sourceUrl, commitHash, builtAt, Map.of(), "", null);
    }
}
