package io.edgeenroll.core.signing;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.SignatureException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Set;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.ContentVerifierProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequest;

/**
 * {@link CsrSigner} backed by BouncyCastle.
 *
 * <p>
 * The issued certificate takes its subject and public key from the request
 * and gets a random 127-bit serial, {@code NotBefore = now},
 * {@code NotAfter = now + validity} (never later than the CA's own expiry),
 * key usage {@code digitalSignature | keyEncipherment}, the requested extended
 * key usages, key identifiers, and any subject alternative names the request
 * asks for. The signature algorithm follows the CA key type.
 */
public final class BouncyCastleCsrSigner implements CsrSigner {

    private static final String PEM_MARKER = "-----BEGIN";

    private final Clock clock;
    private final SecureRandom random;

    public BouncyCastleCsrSigner() {
        this(Clock.systemUTC());
    }

    public BouncyCastleCsrSigner(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = new SecureRandom();
    }

    @Override
    public X509Certificate sign(
            byte[] csr, X509Certificate caCert, PrivateKey caKey, Set<ExtendedKeyUsage> usages, Duration validity)
            throws IOException, GeneralSecurityException {
        PKCS10CertificationRequest request = decode(csr);
        verifyProofOfPossession(request);
        PublicKey subjectKey = new JcaPKCS10CertificationRequest(request).getPublicKey();

        Instant notBefore = clock.instant();
        Instant notAfter = notBefore.plus(validity);
        Instant caNotAfter = caCert.getNotAfter().toInstant();
        if (notAfter.isAfter(caNotAfter)) {
            notAfter = caNotAfter;
        }

        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                caCert,
                new BigInteger(127, random).setBit(0),
                Date.from(notBefore),
                Date.from(notAfter),
                request.getSubject(),
                subjectKey);

        JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
        builder.addExtension(
                Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));
        builder.addExtension(Extension.extendedKeyUsage, false, toExtendedKeyUsage(usages));
        builder.addExtension(
                Extension.subjectKeyIdentifier, false, extensionUtils.createSubjectKeyIdentifier(subjectKey));
        builder.addExtension(
                Extension.authorityKeyIdentifier, false, extensionUtils.createAuthorityKeyIdentifier(caCert));
        Extension subjectAltNames = requestedSubjectAltNames(request);
        if (subjectAltNames != null) {
            builder.addExtension(subjectAltNames);
        }

        ContentSigner signer;
        try {
            signer = new JcaContentSignerBuilder(signatureAlgorithm(caKey)).build(caKey);
        } catch (OperatorCreationException e) {
            throw new GeneralSecurityException("cannot create CA content signer: " + e.getMessage(), e);
        }
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }

    private static PKCS10CertificationRequest decode(byte[] csr) throws IOException {
        if (csr == null || csr.length == 0) {
            throw new IOException("certificate signing request is empty");
        }
        String text = new String(csr, StandardCharsets.ISO_8859_1);
        if (!text.contains(PEM_MARKER)) {
            return new PKCS10CertificationRequest(csr);
        }
        try (PEMParser parser = new PEMParser(new StringReader(text))) {
            Object object = parser.readObject();
            if (object instanceof PKCS10CertificationRequest request) {
                return request;
            }
            throw new IOException("PEM payload is not a CERTIFICATE REQUEST");
        }
    }

    private static void verifyProofOfPossession(PKCS10CertificationRequest request)
            throws GeneralSecurityException {
        try {
            ContentVerifierProvider verifier =
                    new JcaContentVerifierProviderBuilder().build(request.getSubjectPublicKeyInfo());
            if (!request.isSignatureValid(verifier)) {
                throw new SignatureException("certificate signing request signature is invalid");
            }
        } catch (OperatorCreationException | PKCSException e) {
            throw new SignatureException("cannot verify certificate signing request: " + e.getMessage(), e);
        }
    }

    private static org.bouncycastle.asn1.x509.ExtendedKeyUsage toExtendedKeyUsage(Set<ExtendedKeyUsage> usages) {
        Set<ExtendedKeyUsage> effective = usages == null || usages.isEmpty() ? KeyUsages.DEFAULT : usages;
        KeyPurposeId[] purposes =
                effective.stream().map(ExtendedKeyUsage::keyPurpose).toArray(KeyPurposeId[]::new);
        return new org.bouncycastle.asn1.x509.ExtendedKeyUsage(purposes);
    }

    private static Extension requestedSubjectAltNames(PKCS10CertificationRequest request) {
        for (org.bouncycastle.asn1.pkcs.Attribute attribute :
                request.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest)) {
            if (attribute.getAttrValues().size() == 0) {
                continue;
            }
            Extensions extensions = Extensions.getInstance(attribute.getAttrValues().getObjectAt(0));
            Extension subjectAltNames = extensions.getExtension(Extension.subjectAlternativeName);
            if (subjectAltNames != null) {
                return subjectAltNames;
            }
        }
        return null;
    }

    static String signatureAlgorithm(PrivateKey caKey) throws NoSuchAlgorithmException {
        return switch (caKey.getAlgorithm()) {
            case "EC", "ECDSA" -> "SHA256withECDSA";
            case "RSA" -> "SHA256withRSA";
            case "Ed25519", "EdDSA" -> "Ed25519";
            default -> throw new NoSuchAlgorithmException("unsupported CA key algorithm: " + caKey.getAlgorithm());
        };
    }
}
