package io.edgeenroll.core.signing;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;
import java.time.Duration;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

/**
 * A freshly issued certificate. Returned to the caller and not retained.
 *
 * @param certificate the signed certificate
 */
public record IssuedCertificate(X509Certificate certificate) {

    /** PEM text of the certificate. */
    public String pem() {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(certificate);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public byte[] pemBytes() {
        return pem().getBytes(StandardCharsets.US_ASCII);
    }

    /** Distance between NotBefore and NotAfter. */
    public Duration validity() {
        return Duration.between(
                certificate.getNotBefore().toInstant(), certificate.getNotAfter().toInstant());
    }
}
