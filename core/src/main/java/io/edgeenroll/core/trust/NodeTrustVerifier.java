package io.edgeenroll.core.trust;

import io.edgeenroll.core.error.AuthenticationException;
import io.edgeenroll.core.error.AuthenticationException.AuthPath;
import io.edgeenroll.core.pki.RootOfTrust;
import java.security.GeneralSecurityException;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateParsingException;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Judges a peer certificate presented on the certificate path: it must chain
 * to the {@link RootOfTrust} CA alone, be usable for client authentication,
 * and carry a subject accepted by the {@link SubjectPolicy} for the claimed
 * node.
 *
 * <p>
 * Thread-safe: the trust anchor set is built once and {@link CertPathValidator}
 * instances are obtained per call.
 */
public final class NodeTrustVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(NodeTrustVerifier.class);

    static final String CLIENT_AUTH_OID = "1.3.6.1.5.5.7.3.2";
    static final String ANY_EXTENDED_KEY_USAGE_OID = "2.5.29.37.0";

    private final Set<TrustAnchor> trustAnchors;
    private final SubjectPolicy subjectPolicy;

    public NodeTrustVerifier(RootOfTrust rootOfTrust, SubjectPolicy subjectPolicy) {
        Objects.requireNonNull(rootOfTrust, "rootOfTrust");
        this.trustAnchors = Set.of(new TrustAnchor(rootOfTrust.caCertificate(), null));
        this.subjectPolicy = Objects.requireNonNull(subjectPolicy, "subjectPolicy");
    }

    /**
     * Verifies the certificate for the claimed node.
     *
     * @param certificate the peer certificate
     * @param nodeName    the claimed node name
     * @throws AuthenticationException if the chain, key usage or subject check
     *                                 fails
     */
    public void verify(X509Certificate certificate, String nodeName) {
        Objects.requireNonNull(certificate, "certificate");
        verifyChain(certificate, nodeName);
        verifyClientAuthUsage(certificate, nodeName);

        SubjectPolicy.Match match = subjectPolicy.evaluate(certificate, nodeName);
        switch (match) {
            case LEGACY -> LOG.warn(
                    "Node {} authenticated with a legacy subject certificate ({}); reissue before the legacy rule is disabled",
                    nodeName,
                    certificate.getSubjectX500Principal().getName());
            case NODE -> LOG.debug("Certificate subject matches node {}", nodeName);
            case NONE -> throw new AuthenticationException(
                    "node name does not match certificate subject " + certificate.getSubjectX500Principal().getName(),
                    nodeName,
                    AuthPath.CERTIFICATE);
            default -> throw new IllegalStateException("Unknown subject match: " + match);
        }
    }

    private void verifyChain(X509Certificate certificate, String nodeName) {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            CertPath path = factory.generateCertPath(List.of(certificate));
            PKIXParameters params = new PKIXParameters(trustAnchors);
            params.setRevocationEnabled(false);
            CertPathValidator.getInstance("PKIX").validate(path, params);
        } catch (CertPathValidatorException e) {
            throw new AuthenticationException(
                    "chain verification failed: " + e.getMessage(), e, nodeName, AuthPath.CERTIFICATE);
        } catch (GeneralSecurityException e) {
            throw new AuthenticationException(
                    "chain verification could not run: " + e.getMessage(), e, nodeName, AuthPath.CERTIFICATE);
        }
    }

    /** A certificate without an EKU extension is unrestricted. */
    private static void verifyClientAuthUsage(X509Certificate certificate, String nodeName) {
        List<String> usages;
        try {
            usages = certificate.getExtendedKeyUsage();
        } catch (CertificateParsingException e) {
            throw new AuthenticationException(
                    "chain verification failed: unreadable extended key usage", e, nodeName, AuthPath.CERTIFICATE);
        }
        if (usages == null || usages.contains(CLIENT_AUTH_OID) || usages.contains(ANY_EXTENDED_KEY_USAGE_OID)) {
            return;
        }
        throw new AuthenticationException(
                "chain verification failed: certificate is not valid for client authentication",
                nodeName,
                AuthPath.CERTIFICATE);
    }
}
