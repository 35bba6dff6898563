package io.edgeenroll.server.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.edgeenroll.core.evidence.ForwardedCertificateExtractor;
import io.edgeenroll.server.config.ForwardedCertConfig;
import io.edgeenroll.server.testkit.GatewayPki;
import io.javalin.http.Context;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.file.Path;
import java.security.cert.X509Certificate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link ForwardedCertificateFilter}: which forwarded headers are
 * honoured and what happens to the transport identity.
 */
@DisplayName("ForwardedCertificateFilter")
class ForwardedCertificateFilterTest {

    private static final String HEADER = ForwardedCertConfig.DEFAULT_HEADER;
    private static final String PROXY = "10.1.2.3";

    @TempDir
    Path tempDir;

    private GatewayPki pki;
    private X509Certificate transportCert;
    private X509Certificate forwardedCert;
    private ConnectionSecurityContext security;
    private Context ctx;
    private HttpServletRequest request;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger filterLogger;

    @BeforeEach
    void setUp() {
        pki = GatewayPki.create(tempDir);
        transportCert = pki.node("transport").certificate();
        forwardedCert = pki.node("edge1").certificate();
        security = ConnectionSecurityContext.fromTransport(new X509Certificate[] {transportCert});

        ctx = mock(Context.class);
        request = mock(HttpServletRequest.class);
        when(ctx.req()).thenReturn(request);
        when(ctx.<ConnectionSecurityContext>attribute(ConnectionSecurityContext.ATTRIBUTE))
                .thenReturn(security);
        when(request.getRemoteAddr()).thenReturn(PROXY);

        filterLogger = (Logger) LoggerFactory.getLogger(ForwardedCertificateFilter.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        filterLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        filterLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private ForwardedCertificateFilter filter(boolean enabled, String... trustedSources) {
        return new ForwardedCertificateFilter(
                new ForwardedCertConfig(enabled, HEADER, List.of(trustedSources)),
                new ForwardedCertificateExtractor());
    }

    @Test
    @DisplayName("No header → transport identity untouched")
    void noHeader_leavesTransportIdentity() {
        filter(true, "10.0.0.0/8").handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.TRANSPORT);
        assertThat(security.peerCertificates()).containsExactly(transportCert);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Empty header from trusted proxy → treated as absent, transport identity kept")
    void emptyHeader_leavesTransportIdentity(String headerValue) {
        when(ctx.header(HEADER)).thenReturn(headerValue);

        filter(true, "10.0.0.0/8").handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.TRANSPORT);
        assertThat(security.peerCertificates()).containsExactly(transportCert);
        assertThat(logAppender.list).isEmpty();
    }

    @Test
    @DisplayName("Valid header from trusted proxy → forwarded certificate replaces transport")
    void trustedValidHeader_replacesPeerCertificate() {
        when(ctx.header(HEADER)).thenReturn(GatewayPki.forwardedHeader(forwardedCert));

        filter(true, "10.0.0.0/8").handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.FORWARDED);
        assertThat(security.peerCertificates()).containsExactly(forwardedCert);
    }

    @Test
    @DisplayName("Undecodable header from trusted proxy → all peer certificates dropped")
    void trustedInvalidHeader_resetsContext() {
        when(ctx.header(HEADER)).thenReturn("bm90LWEtY2VydGlmaWNhdGU=");

        filter(true, "10.0.0.0/8").handle(ctx);

        assertThat(security.hasPeerCertificate()).isFalse();
        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.NONE);
    }

    @Test
    @DisplayName("Undecodable header is logged without echoing its value")
    void invalidHeader_notEchoedInLogs() {
        String secretLooking = "c2VjcmV0LXZhbHVlLXRoYXQtaXMtbm90LWEtY2VydA==";
        when(ctx.header(HEADER)).thenReturn(secretLooking);

        filter(true, "10.0.0.0/8").handle(ctx);

        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .hasSize(1)
                .allSatisfy(event -> assertThat(event.getFormattedMessage())
                        .contains(PROXY)
                        .doesNotContain(secretLooking));
    }

    @Test
    @DisplayName("Header from untrusted peer → ignored with a warning")
    void untrustedSource_isIgnored() {
        when(ctx.header(HEADER)).thenReturn(GatewayPki.forwardedHeader(forwardedCert));

        filter(true, "192.168.0.0/16").handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.TRANSPORT);
        assertThat(security.peerCertificates()).containsExactly(transportCert);
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).contains("untrusted source " + PROXY));
    }

    @Test
    @DisplayName("Forwarding disabled → header ignored even from a listed proxy")
    void disabled_ignoresHeader() {
        when(ctx.header(HEADER)).thenReturn(GatewayPki.forwardedHeader(forwardedCert));

        filter(false, "10.0.0.0/8").handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.TRANSPORT);
    }

    @Test
    @DisplayName("Enabled with no trusted sources → startup warning, header ignored")
    void enabledWithoutTrustedSources_warnsAndIgnores() {
        when(ctx.header(HEADER)).thenReturn(GatewayPki.forwardedHeader(forwardedCert));

        ForwardedCertificateFilter filter = filter(true);
        filter.handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.TRANSPORT);
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).contains("no trusted sources are configured"));
    }

    @Test
    @DisplayName("Custom header name is honoured")
    void customHeaderName() {
        when(ctx.header("X-Client-Cert")).thenReturn(GatewayPki.forwardedHeader(forwardedCert));

        new ForwardedCertificateFilter(
                        new ForwardedCertConfig(true, "X-Client-Cert", List.of(PROXY)),
                        new ForwardedCertificateExtractor())
                .handle(ctx);

        assertThat(security.source()).isEqualTo(ConnectionSecurityContext.Source.FORWARDED);
    }
}
