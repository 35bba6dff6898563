package io.edgeenroll.core.pki;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.HexFormat;
import java.util.Objects;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;

/**
 * The CA certificate and private key against which every presented
 * certificate is validated and with which every issued certificate is signed.
 *
 * <p>
 * Built once at startup and never mutated afterwards, so a single instance is
 * shared by all request threads without locking. Accessors that expose byte
 * arrays return copies.
 */
public final class RootOfTrust {

    private static final String PKCS8_BLOCK_TYPE = "PRIVATE KEY";

    private final X509Certificate caCertificate;
    private final PrivateKey caKey;
    private final byte[] caCertificateDer;
    private final byte[] tokenSecret;
    private final String caHash;

    private RootOfTrust(X509Certificate caCertificate, PrivateKey caKey) throws CertificateEncodingException {
        this.caCertificate = caCertificate;
        this.caKey = caKey;
        this.caCertificateDer = caCertificate.getEncoded();
        this.tokenSecret = pkcs8Pem(caKey);
        this.caHash = sha256Hex(caCertificateDer);
    }

    /**
     * Creates a root of trust from already-parsed material.
     *
     * @throws IllegalArgumentException if the key does not belong to the
     *                                  certificate's key algorithm
     */
    public static RootOfTrust of(X509Certificate caCertificate, PrivateKey caKey) {
        Objects.requireNonNull(caCertificate, "caCertificate");
        Objects.requireNonNull(caKey, "caKey");
        String certAlgorithm = caCertificate.getPublicKey().getAlgorithm();
        if (!certAlgorithm.equals(caKey.getAlgorithm())) {
            throw new IllegalArgumentException("CA key algorithm " + caKey.getAlgorithm()
                    + " does not match CA certificate key algorithm " + certAlgorithm);
        }
        try {
            return new RootOfTrust(caCertificate, caKey);
        } catch (CertificateEncodingException e) {
            throw new IllegalArgumentException("CA certificate cannot be encoded", e);
        }
    }

    /**
     * Loads the CA certificate and key from PEM files. The certificate file may
     * also hold a bare DER certificate; the key file may be PKCS#8, SEC1 (EC)
     * or PKCS#1 (RSA) PEM.
     *
     * @param certFile path to the CA certificate
     * @param keyFile  path to the CA private key
     * @return the loaded root of trust
     * @throws IOException              if either file cannot be read
     * @throws GeneralSecurityException if either file does not hold the expected
     *                                  material
     */
    public static RootOfTrust load(Path certFile, Path keyFile) throws IOException, GeneralSecurityException {
        X509Certificate certificate = readCertificate(certFile);
        PrivateKey key = readPrivateKey(keyFile);
        try {
            return of(certificate, key);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException(e.getMessage(), e);
        }
    }

    public X509Certificate caCertificate() {
        return caCertificate;
    }

    public PrivateKey caKey() {
        return caKey;
    }

    /** DER encoding of the CA certificate, as served by the discovery endpoint. */
    public byte[] caCertificateDer() {
        return caCertificateDer.clone();
    }

    /**
     * Shared secret for bearer token MACs: the PEM ("PRIVATE KEY", PKCS#8)
     * encoding of the CA key.
     */
    public byte[] tokenSecret() {
        return tokenSecret.clone();
    }

    /** Lower-case hex SHA-256 of the CA certificate DER, used to pin the CA in join tokens. */
    public String caHash() {
        return caHash;
    }

    private static X509Certificate readCertificate(Path certFile) throws IOException, GeneralSecurityException {
        byte[] raw = Files.readAllBytes(certFile);
        String text = new String(raw, StandardCharsets.ISO_8859_1);
        if (!text.contains("-----BEGIN ")) {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(raw));
        }
        try (PEMParser parser = new PEMParser(new StringReader(text))) {
            Object object = parser.readObject();
            if (object instanceof X509CertificateHolder holder) {
                return new JcaX509CertificateConverter().getCertificate(holder);
            }
            throw new CertificateException("Expected a CERTIFICATE block in " + certFile + " but found "
                    + (object == null ? "nothing" : object.getClass().getSimpleName()));
        }
    }

    private static PrivateKey readPrivateKey(Path keyFile) throws IOException, GeneralSecurityException {
        try (Reader reader = Files.newBufferedReader(keyFile, StandardCharsets.US_ASCII);
                PEMParser parser = new PEMParser(reader)) {
            Object object = parser.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            if (object instanceof PEMKeyPair keyPair) {
                return converter.getKeyPair(keyPair).getPrivate();
            }
            if (object instanceof PrivateKeyInfo keyInfo) {
                return converter.getPrivateKey(keyInfo);
            }
            throw new GeneralSecurityException("No unencrypted private key found in " + keyFile);
        }
    }

    private static byte[] pkcs8Pem(PrivateKey key) {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject(PKCS8_BLOCK_TYPE, key.getEncoded()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString().getBytes(StandardCharsets.US_ASCII);
    }

    private static String sha256Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
