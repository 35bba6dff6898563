package io.edgeenroll.core.error;

/**
 * Thrown when a forwarded certificate header cannot be decoded into an X.509
 * certificate (bad base64, no usable PEM block, or an unparseable DER body).
 *
 * <p>
 * Internal only: the request filter converts it into "no certificate
 * available" and never shows the message to the client.
 */
public final class CertificateParseException extends EnrollmentException {

    private static final long serialVersionUID = 1L;

    public CertificateParseException(String message) {
        super(message, null, Stage.EVIDENCE);
    }

    public CertificateParseException(String message, Throwable cause) {
        super(message, cause, null, Stage.EVIDENCE);
    }
}
