package io.edgeenroll.core.error;

/**
 * Thrown when a certificate cannot be issued: malformed key-usage list,
 * unreadable CSR body, or a failure inside the CA signing primitive.
 */
public final class SigningException extends EnrollmentException {

    private static final long serialVersionUID = 1L;

    public SigningException(String message) {
        super(message, null, Stage.SIGNING);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause, null, Stage.SIGNING);
    }

    public SigningException(String message, Throwable cause, String nodeName) {
        super(message, cause, nodeName, Stage.SIGNING);
    }
}
