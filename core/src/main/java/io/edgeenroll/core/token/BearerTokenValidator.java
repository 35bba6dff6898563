package io.edgeenroll.core.token;

import io.edgeenroll.core.error.AuthenticationException;
import io.edgeenroll.core.error.AuthenticationException.AuthPath;
import io.edgeenroll.core.pki.RootOfTrust;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback authentication for requests that carry no peer certificate. The
 * {@code Authorization} header must be exactly {@code "<scheme> <token>"}
 * (two parts separated by a single space); the token is checked by the
 * {@link TokenVerifier} using the CA-derived secret from {@link RootOfTrust}.
 */
public final class BearerTokenValidator {

    private static final Logger LOG = LoggerFactory.getLogger(BearerTokenValidator.class);

    private final RootOfTrust rootOfTrust;
    private final TokenVerifier tokenVerifier;

    public BearerTokenValidator(RootOfTrust rootOfTrust, TokenVerifier tokenVerifier) {
        this.rootOfTrust = Objects.requireNonNull(rootOfTrust, "rootOfTrust");
        this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier");
    }

    /**
     * Validates the header.
     *
     * @param authorization the raw {@code Authorization} header value (may be
     *                      {@code null})
     * @param nodeName      the claimed node name, for diagnostics
     * @throws AuthenticationException if the header is empty, malformed, or the
     *                                 token is not valid
     */
    public void validate(String authorization, String nodeName) {
        if (authorization == null || authorization.isEmpty()) {
            throw new AuthenticationException("token validation failure, token is empty", nodeName, AuthPath.TOKEN);
        }
        LOG.debug("Authorization header received: {}", redact(authorization));

        String[] parts = authorization.split(" ", -1);
        if (parts.length != 2 || parts[1].isEmpty()) {
            throw new AuthenticationException(
                    "token validation failure, malformed authorization header", nodeName, AuthPath.TOKEN);
        }

        boolean valid;
        try {
            valid = tokenVerifier.verify(parts[1], rootOfTrust.tokenSecret());
        } catch (TokenVerificationException e) {
            throw new AuthenticationException(
                    "token validation failure, " + e.getMessage(), e, nodeName, AuthPath.TOKEN);
        }
        if (!valid) {
            throw new AuthenticationException("token validation failure, token is not valid", nodeName, AuthPath.TOKEN);
        }
    }

    /** Keeps the scheme and the first characters of the credential. */
    static String redact(String authorization) {
        int space = authorization.indexOf(' ');
        String scheme = space >= 0 ? authorization.substring(0, space) : "";
        String credential = space >= 0 ? authorization.substring(space + 1) : authorization;
        String visible = credential.length() > 6 ? credential.substring(0, 6) : "";
        return (scheme.isEmpty() ? "" : scheme + " ") + visible + "***";
    }
}
