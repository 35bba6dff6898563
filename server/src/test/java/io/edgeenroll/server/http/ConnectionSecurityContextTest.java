package io.edgeenroll.server.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.security.cert.X509Certificate;
import org.junit.jupiter.api.Test;

class ConnectionSecurityContextTest {

    private final X509Certificate transport = mock(X509Certificate.class);
    private final X509Certificate forwarded = mock(X509Certificate.class);

    @Test
    void transportChainBecomesPeerCertificates() {
        ConnectionSecurityContext security =
                ConnectionSecurityContext.fromTransport(new X509Certificate[] {transport});

        assertThat(security.hasPeerCertificate()).isTrue();
        assertThat(security.peerCertificates()).containsExactly(transport);
        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.TRANSPORT);
    }

    @Test
    void missingOrEmptyTransportChainIsEmpty() {
        assertThat(ConnectionSecurityContext.fromTransport(null).hasPeerCertificate()).isFalse();
        assertThat(ConnectionSecurityContext.fromTransport(new X509Certificate[0]).hasPeerCertificate())
                .isFalse();
        assertThat(ConnectionSecurityContext.fromTransport("not a chain").source())
                .isEqualTo(ConnectionSecurityContext.Source.NONE);
    }

    @Test
    void forwardedCertificateReplacesTransportChain() {
        ConnectionSecurityContext security =
                ConnectionSecurityContext.fromTransport(new X509Certificate[] {transport});

        security.useForwarded(forwarded);

        assertThat(security.peerCertificates()).containsExactly(forwarded);
        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.FORWARDED);
    }

    @Test
    void resetDropsEverything() {
        ConnectionSecurityContext security =
                ConnectionSecurityContext.fromTransport(new X509Certificate[] {transport});

        security.reset();

        assertThat(security.peerCertificates()).isEmpty();
        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.NONE);
    }
}
