package io.edgeenroll.core.token;

/** Thrown by a {@link TokenVerifier} when a token cannot be parsed or checked. */
public class TokenVerificationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
