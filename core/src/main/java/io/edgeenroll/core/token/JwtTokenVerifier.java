package io.edgeenroll.core.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.Objects;

/**
 * Verifies HMAC-signed JWTs (HS256/384/512). Tokens signed with any other
 * algorithm are rejected as unprocessable. A token whose {@code exp} claim lies
 * in the past, or whose {@code nbf} claim lies in the future, is reported as
 * invalid.
 */
public final class JwtTokenVerifier implements TokenVerifier {

    private final Clock clock;

    public JwtTokenVerifier() {
        this(Clock.systemUTC());
    }

    public JwtTokenVerifier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean verify(String token, byte[] secret) {
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new TokenVerificationException("token is not a signed JWT: " + e.getMessage(), e);
        }

        JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
        if (!JWSAlgorithm.Family.HMAC_SHA.contains(algorithm)) {
            throw new TokenVerificationException("unexpected signing method: " + algorithm);
        }

        try {
            if (!jwt.verify(new MACVerifier(secret))) {
                return false;
            }
        } catch (JOSEException e) {
            throw new TokenVerificationException("token signature could not be checked: " + e.getMessage(), e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new TokenVerificationException("token claims are malformed: " + e.getMessage(), e);
        }
        Date now = Date.from(clock.instant());
        if (claims.getExpirationTime() != null && !now.before(claims.getExpirationTime())) {
            return false;
        }
        return claims.getNotBeforeTime() == null || !now.before(claims.getNotBeforeTime());
    }
}
