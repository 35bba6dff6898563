package io.edgeenroll.core.error;

/**
 * Thrown when the presented trust evidence is rejected: certificate chain
 * failure, subject mismatch, or an empty, malformed or invalid bearer token.
 * Rendered as HTTP {@link #statusCode()} (always 401).
 */
public final class AuthenticationException extends EnrollmentException {

    private static final long serialVersionUID = 1L;

    /** HTTP status used for every authentication failure. */
    public static final int UNAUTHORIZED = 401;

    /** Which of the two authentication mechanisms produced the failure. */
    public enum AuthPath {
        CERTIFICATE("certificate"),
        TOKEN("token");

        private final String label;

        AuthPath(String label) {
            this.label = label;
        }

        /** Lower-case label used in logs and MDC. */
        public String label() {
            return label;
        }
    }

    private final AuthPath authPath;

    public AuthenticationException(String message, String nodeName, AuthPath authPath) {
        super(message, nodeName, Stage.AUTHENTICATION);
        this.authPath = authPath;
    }

    public AuthenticationException(String message, Throwable cause, String nodeName, AuthPath authPath) {
        super(message, cause, nodeName, Stage.AUTHENTICATION);
        this.authPath = authPath;
    }

    public AuthPath authPath() {
        return authPath;
    }

    public int statusCode() {
        return UNAUTHORIZED;
    }
}
