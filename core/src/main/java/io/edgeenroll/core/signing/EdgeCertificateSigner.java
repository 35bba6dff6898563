package io.edgeenroll.core.signing;

import io.edgeenroll.core.error.SigningException;
import io.edgeenroll.core.pki.RootOfTrust;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues edge node certificates from the {@link RootOfTrust}. Resolves the
 * requested usages and the configured validity, then delegates the actual
 * signing to a {@link CsrSigner}; any primitive failure surfaces as a
 * {@link SigningException}.
 */
public final class EdgeCertificateSigner {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeCertificateSigner.class);

    private final RootOfTrust rootOfTrust;
    private final CsrSigner csrSigner;
    private final Duration validity;

    /**
     * @param rootOfTrust  the issuing CA
     * @param csrSigner    the signing primitive
     * @param validityDays configured lifetime in days; not validated here
     */
    public EdgeCertificateSigner(RootOfTrust rootOfTrust, CsrSigner csrSigner, int validityDays) {
        this.rootOfTrust = Objects.requireNonNull(rootOfTrust, "rootOfTrust");
        this.csrSigner = Objects.requireNonNull(csrSigner, "csrSigner");
        this.validity = Duration.ofHours(24L * validityDays);
    }

    /** Lifetime applied to every issued certificate ({@code days * 24h}). */
    public Duration validity() {
        return validity;
    }

    /**
     * Builds a request with the configured validity.
     *
     * @param csr          raw CSR bytes
     * @param usagesHeader the {@code Ext-Key-Usages} header value, may be
     *                     {@code null}
     * @throws SigningException if the usages header cannot be parsed
     */
    public SigningRequest newRequest(byte[] csr, String usagesHeader) {
        return new SigningRequest(csr, KeyUsages.parse(usagesHeader), validity);
    }

    /**
     * Signs the request.
     *
     * @throws SigningException if the signing primitive fails
     */
    public IssuedCertificate sign(SigningRequest request) {
        LOG.debug("Signing CSR: usages={}, validity={}", request.usages(), request.validity());
        try {
            X509Certificate certificate = csrSigner.sign(
                    request.csr(),
                    rootOfTrust.caCertificate(),
                    rootOfTrust.caKey(),
                    request.usages(),
                    request.validity());
            return new IssuedCertificate(certificate);
        } catch (IOException | GeneralSecurityException e) {
            throw new SigningException("fail to sign certificate: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new SigningException("fail to sign certificate, malformed request: " + e.getMessage(), e);
        }
    }
}
