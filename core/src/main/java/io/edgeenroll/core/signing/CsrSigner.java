package io.edgeenroll.core.signing;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Set;

/**
 * The CA signing primitive: turns a certificate-signing request into a
 * certificate issued by the given CA.
 *
 * <p>
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface CsrSigner {

    /**
     * Signs the request.
     *
     * @param csr      the PKCS#10 request, DER or PEM encoded
     * @param caCert   the issuing CA certificate
     * @param caKey    the issuing CA private key
     * @param usages   extended key usages to grant
     * @param validity lifetime of the issued certificate
     * @return the issued certificate
     * @throws IOException              if the request cannot be decoded
     * @throws GeneralSecurityException if the request is not self-consistent or
     *                                  signing fails
     */
    X509Certificate sign(
            byte[] csr, X509Certificate caCert, PrivateKey caKey, Set<ExtendedKeyUsage> usages, Duration validity)
            throws IOException, GeneralSecurityException;
}
