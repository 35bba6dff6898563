package io.edgeenroll.core.evidence;

import io.edgeenroll.core.error.CertificateParseException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a client certificate forwarded by a TLS-terminating proxy in a
 * request header.
 *
 * <p>
 * The header value is standard base64. The decoded payload is either one or
 * more PEM blocks (the first {@code CERTIFICATE} block whose body decodes
 * wins, other block types are skipped) or, when it contains no PEM block at
 * all, a bare DER certificate with no trailing bytes. Line breaks and spaces inside a PEM body are ignored, so
 * proxies that fold the PEM onto a single line are accepted.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ForwardedCertificateExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardedCertificateExtractor.class);

    static final String CERTIFICATE_BLOCK_TYPE = "CERTIFICATE";

    private static final Pattern PEM_BLOCK =
            Pattern.compile("-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Extracts the forwarded certificate.
     *
     * @param headerValue the raw header value
     * @return the decoded certificate
     * @throws CertificateParseException if the value is not base64, holds no
     *                                   usable certificate, or the selected
     *                                   bytes are not a valid X.509 certificate
     */
    public X509Certificate extract(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new CertificateParseException("Forwarded certificate header is empty");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(headerValue.trim());
        } catch (IllegalArgumentException e) {
            throw new CertificateParseException("Forwarded certificate header is not valid base64", e);
        }

        byte[] der = selectCertificateBytes(decoded);
        return parseDer(der);
    }

    /**
     * Returns the body of the first {@code CERTIFICATE} PEM block, or the input
     * itself when no PEM block of any type is present.
     */
    private static byte[] selectCertificateBytes(byte[] decoded) {
        String text = new String(decoded, StandardCharsets.ISO_8859_1);
        Matcher matcher = PEM_BLOCK.matcher(text);
        boolean sawBlock = false;
        while (matcher.find()) {
            sawBlock = true;
            if (!CERTIFICATE_BLOCK_TYPE.equals(matcher.group(1))) {
                continue;
            }
            String body = WHITESPACE.matcher(matcher.group(2)).replaceAll("");
            try {
                return Base64.getDecoder().decode(body);
            } catch (IllegalArgumentException e) {
                LOG.debug("Skipping CERTIFICATE PEM block with a malformed body: {}", e.getMessage());
            }
        }
        if (sawBlock) {
            throw new CertificateParseException(
                    "Forwarded payload contains PEM blocks but no usable CERTIFICATE block");
        }
        return decoded;
    }

    private static X509Certificate parseDer(byte[] der) {
        if (der.length == 0) {
            throw new CertificateParseException("Forwarded certificate payload is empty");
        }
        X509Certificate certificate;
        int consumed;
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            certificate = (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
            consumed = certificate.getEncoded().length;
        } catch (CertificateException | RuntimeException e) {
            throw new CertificateParseException("Forwarded certificate is not a valid X.509 certificate", e);
        }
        if (consumed != der.length) {
            throw new CertificateParseException("Forwarded certificate has " + (der.length - consumed)
                    + " bytes of trailing data");
        }
        return certificate;
    }
}
