package io.edgeenroll.core.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.edgeenroll.core.testkit.TestPki;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.ECPrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import org.junit.jupiter.api.Test;

class JwtTokenVerifierTest {

    private static final byte[] SECRET =
            "an-hmac-secret-that-is-comfortably-longer-than-256-bits".getBytes(StandardCharsets.US_ASCII);
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final JwtTokenVerifier verifier = new JwtTokenVerifier(Clock.fixed(NOW, ZoneOffset.UTC));

    private static String hs256(JWTClaimsSet claims) throws Exception {
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(SECRET));
        return jwt.serialize();
    }

    @Test
    void acceptsTokenWithinItsWindow() throws Exception {
        String token = hs256(new JWTClaimsSet.Builder()
                .notBeforeTime(Date.from(NOW.minus(Duration.ofMinutes(1))))
                .expirationTime(Date.from(NOW.plus(Duration.ofMinutes(1))))
                .build());

        assertThat(verifier.verify(token, SECRET)).isTrue();
    }

    @Test
    void acceptsTokenWithoutTimeClaims() throws Exception {
        assertThat(verifier.verify(hs256(new JWTClaimsSet.Builder().subject("edge").build()), SECRET))
                .isTrue();
    }

    @Test
    void expiryInstantIsAlreadyInvalid() throws Exception {
        String token = hs256(new JWTClaimsSet.Builder().expirationTime(Date.from(NOW)).build());

        assertThat(verifier.verify(token, SECRET)).isFalse();
    }

    @Test
    void notYetValidTokenIsInvalid() throws Exception {
        String token = hs256(new JWTClaimsSet.Builder()
                .notBeforeTime(Date.from(NOW.plus(Duration.ofHours(1))))
                .build());

        assertThat(verifier.verify(token, SECRET)).isFalse();
    }

    @Test
    void wrongSecretIsInvalid() throws Exception {
        String token = hs256(new JWTClaimsSet.Builder().build());
        byte[] other = "another-hmac-secret-that-is-also-longer-than-256-bits".getBytes(StandardCharsets.US_ASCII);

        assertThat(verifier.verify(token, other)).isFalse();
    }

    @Test
    void nonHmacAlgorithmIsRejected() throws Exception {
        ECPrivateKey key = (ECPrivateKey) TestPki.generateKeyPair().getPrivate();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.ES256), new JWTClaimsSet.Builder().build());
        jwt.sign(new ECDSASigner(key));

        assertThatThrownBy(() -> verifier.verify(jwt.serialize(), SECRET))
                .isInstanceOf(TokenVerificationException.class)
                .hasMessageContaining("unexpected signing method");
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> verifier.verify("a.b", SECRET)).isInstanceOf(TokenVerificationException.class);
    }
}
