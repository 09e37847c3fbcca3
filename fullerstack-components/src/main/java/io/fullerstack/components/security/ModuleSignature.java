package io.fullerstack.components.security;

import java.time.Instant;
import java.util.Objects;

/**
 * Signature attached to a component's code.
 *
 * @param codeHash  hash of the component code
 * @param signature signature over the code hash
 * @param publicKey key the signature verifies against
 * @param signedAt  signing time
 * @param algorithm signature algorithm, e.g. {@code SHA256-RSA}
 */
public record ModuleSignature(
    String codeHash,
    String signature,
    String publicKey,
    Instant signedAt,
    String algorithm
) {

    public ModuleSignature {
        Objects.requireNonNull(codeHash, "codeHash");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(signedAt, "signedAt");
        Objects.requireNonNull(algorithm, "algorithm");
    }

    @Override
    public String toString() {
        // keys and signatures stay out of logs
        return "ModuleSignature[algorithm=" + algorithm + ", signedAt=" + signedAt + "]";
    }
}
