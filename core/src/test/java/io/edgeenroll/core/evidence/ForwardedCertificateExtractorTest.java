package io.edgeenroll.core.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.edgeenroll.core.error.CertificateParseException;
import io.edgeenroll.core.error.EnrollmentException;
import io.edgeenroll.core.testkit.TestPki;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Base64;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ForwardedCertificateExtractor")
class ForwardedCertificateExtractorTest {

    private static X509Certificate nodeCert;
    private static X509Certificate otherCert;

    private final ForwardedCertificateExtractor extractor = new ForwardedCertificateExtractor();

    @BeforeAll
    static void createPki() {
        TestPki pki = TestPki.create();
        nodeCert = pki.nodeCertificate("alpha").certificate();
        otherCert = pki.nodeCertificate("beta").certificate();
    }

    @Nested
    @DisplayName("Accepted encodings")
    class Accepted {

        @Test
        @DisplayName("base64(PEM) → same serial and subject")
        void pemRoundTrip() {
            X509Certificate extracted = extractor.extract(TestPki.forwardedHeader(nodeCert));

            assertThat(extracted.getSerialNumber()).isEqualTo(nodeCert.getSerialNumber());
            assertThat(extracted.getSubjectX500Principal()).isEqualTo(nodeCert.getSubjectX500Principal());
        }

        @Test
        @DisplayName("base64(DER) with no PEM armour → DER fallback")
        void derFallback() {
            X509Certificate extracted = extractor.extract(TestPki.forwardedDerHeader(nodeCert));

            assertThat(extracted).isEqualTo(nodeCert);
        }

        @Test
        @DisplayName("Non-certificate blocks are skipped; first CERTIFICATE block wins")
        void firstCertificateBlockWins() {
            KeyPair keyPair = TestPki.generateKeyPair();
            String payload = TestPki.toPem(keyPair.getPublic()) + TestPki.toPem(nodeCert) + TestPki.toPem(otherCert);

            X509Certificate extracted = extractor.extract(encode(payload));

            assertThat(extracted).isEqualTo(nodeCert);
        }

        @Test
        @DisplayName("CERTIFICATE block with a malformed body is skipped for a later valid one")
        void malformedBlockSkipped() {
            String payload = "-----BEGIN CERTIFICATE-----\nMIIB!!!corrupt\n-----END CERTIFICATE-----\n"
                    + TestPki.toPem(otherCert);

            X509Certificate extracted = extractor.extract(encode(payload));

            assertThat(extracted).isEqualTo(otherCert);
        }

        @Test
        @DisplayName("PEM folded onto one line with spaces → accepted")
        void foldedPem() {
            String folded = TestPki.toPem(nodeCert).replace("\r\n", " ").replace("\n", " ");

            X509Certificate extracted = extractor.extract(encode(folded));

            assertThat(extracted).isEqualTo(nodeCert);
        }

        @Test
        @DisplayName("CRLF line endings and surrounding noise → accepted")
        void crlfAndNoise() {
            String noisy = "\r\n  " + TestPki.toPem(nodeCert).replace("\n", "\r\n") + "\n\n";

            X509Certificate extracted = extractor.extract(encode(noisy));

            assertThat(extracted).isEqualTo(nodeCert);
        }

        @Test
        @DisplayName("Whitespace around the header value is trimmed")
        void trimmedHeaderValue() {
            X509Certificate extracted = extractor.extract("  " + TestPki.forwardedHeader(nodeCert) + " ");

            assertThat(extracted).isEqualTo(nodeCert);
        }
    }

    @Nested
    @DisplayName("Rejected inputs")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "***not base64***", "YWJj$$"})
        @DisplayName("Empty or non-base64 header → CertificateParseException")
        void invalidBase64(String header) {
            assertThatThrownBy(() -> extractor.extract(header)).isInstanceOf(CertificateParseException.class);
        }

        @Test
        @DisplayName("null header → CertificateParseException")
        void nullHeader() {
            assertThatThrownBy(() -> extractor.extract(null)).isInstanceOf(CertificateParseException.class);
        }

        @Test
        @DisplayName("base64 of random bytes → CertificateParseException")
        void garbageDer() {
            String header = Base64.getEncoder().encodeToString(new byte[] {0x30, 0x03, 0x02, 0x01, 0x01, 0x7f});

            assertThatThrownBy(() -> extractor.extract(header))
                    .isInstanceOf(CertificateParseException.class)
                    .hasMessageContaining("not a valid X.509 certificate");
        }

        @Test
        @DisplayName("DER followed by trailing bytes → CertificateParseException")
        void trailingDataAfterDer() throws Exception {
            byte[] der = nodeCert.getEncoded();
            byte[] padded = Arrays.copyOf(der, der.length + 2);
            padded[der.length] = 0x00;
            padded[der.length + 1] = 0x01;

            assertThatThrownBy(() -> extractor.extract(Base64.getEncoder().encodeToString(padded)))
                    .isInstanceOf(CertificateParseException.class)
                    .hasMessageContaining("trailing data");
        }

        @Test
        @DisplayName("PEM with only a public key block → CertificateParseException")
        void noCertificateBlock() {
            String payload = TestPki.toPem(TestPki.generateKeyPair().getPublic());

            assertThatThrownBy(() -> extractor.extract(encode(payload)))
                    .isInstanceOf(CertificateParseException.class)
                    .hasMessageContaining("no usable CERTIFICATE block");
        }

        @Test
        @DisplayName("CERTIFICATE block with a corrupted body → CertificateParseException")
        void corruptedCertificateBody() {
            String payload = "-----BEGIN CERTIFICATE-----\nMIIB!!!corrupt\n-----END CERTIFICATE-----\n";

            assertThatThrownBy(() -> extractor.extract(encode(payload))).isInstanceOf(CertificateParseException.class);
        }

        @Test
        @DisplayName("Parse failures belong to the evidence stage and carry no node")
        void parseFailureStage() {
            assertThatThrownBy(() -> extractor.extract("%%%"))
                    .isInstanceOfSatisfying(CertificateParseException.class, e -> {
                        assertThat(e.stage()).isEqualTo(EnrollmentException.Stage.EVIDENCE);
                        assertThat(e.nodeName()).isNull();
                    });
        }
    }

    private static String encode(String payload) {
        return Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.US_ASCII));
    }
}
