package io.edgeenroll.core.token;

/**
 * Cryptographic check of a bearer credential against a shared secret.
 *
 * <p>
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface TokenVerifier {

    /**
     * Verifies the token.
     *
     * @param token  the bearer credential, without its scheme
     * @param secret the verification secret
     * @return {@code true} if the token is authentic and currently valid,
     *         {@code false} if it is well-formed but not valid (bad MAC,
     *         expired)
     * @throws TokenVerificationException if the token cannot be processed at
     *                                    all
     */
    boolean verify(String token, byte[] secret);
}
