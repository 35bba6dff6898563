package io.edgeenroll.core.error;

/**
 * Abstract base for all enrollment failures. Never thrown directly; each
 * concrete subclass belongs to exactly one {@link Stage} of the enrollment
 * pipeline.
 *
 * <p>
 * Every exception carries the claimed node name when one is known, so callers
 * can render a diagnostic naming the node without re-threading request state.
 */
public abstract class EnrollmentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred. */
    public enum Stage {
        /** Decoding trust evidence (forwarded certificate headers). Never rejects a request. */
        EVIDENCE,
        /** Judging trust evidence (certificate chain, subject policy, bearer token). */
        AUTHENTICATION,
        /** Issuing the certificate (usages, CSR body, CA primitive). */
        SIGNING
    }

    private final String nodeName;
    private final Stage stage;

    protected EnrollmentException(String message, String nodeName, Stage stage) {
        super(message);
        this.nodeName = nodeName;
        this.stage = stage;
    }

    protected EnrollmentException(String message, Throwable cause, String nodeName, Stage stage) {
        super(message, cause);
        this.nodeName = nodeName;
        this.stage = stage;
    }

    /** The claimed node name, or {@code null} if not yet known. */
    public String nodeName() {
        return nodeName;
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
