package io.edgeenroll.core.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.edgeenroll.core.pki.RootOfTrust;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * Mints join tokens accepted by {@link BearerTokenValidator} with a
 * {@link JwtTokenVerifier}: HS256 over the CA-derived secret, with an
 * {@code exp} claim {@code ttl} from now.
 */
public final class BootstrapTokenIssuer {

    private final RootOfTrust rootOfTrust;
    private final Clock clock;

    public BootstrapTokenIssuer(RootOfTrust rootOfTrust) {
        this(rootOfTrust, Clock.systemUTC());
    }

    public BootstrapTokenIssuer(RootOfTrust rootOfTrust, Clock clock) {
        this.rootOfTrust = Objects.requireNonNull(rootOfTrust, "rootOfTrust");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Issues a join token.
     *
     * @param ttl how long the bearer credential stays valid; must be positive
     * @return the join token
     */
    public BootstrapToken issue(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("token ttl must be positive");
        }
        Instant now = clock.instant();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(ttl)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(new MACSigner(rootOfTrust.tokenSecret()));
        } catch (JOSEException e) {
            throw new IllegalStateException("Cannot sign join token: " + e.getMessage(), e);
        }
        return new BootstrapToken(rootOfTrust.caHash(), jwt.serialize());
    }
}
