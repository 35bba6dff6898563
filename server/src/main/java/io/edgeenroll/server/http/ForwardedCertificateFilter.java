package io.edgeenroll.server.http;

import io.edgeenroll.core.error.CertificateParseException;
import io.edgeenroll.core.evidence.ForwardedCertificateExtractor;
import io.edgeenroll.server.config.ForwardedCertConfig;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.security.cert.X509Certificate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Before-handler that turns a forwarded client certificate header into the
 * request's {@link ConnectionSecurityContext}.
 *
 * <p>
 * Never rejects a request. An empty header counts as absent. A header that
 * decodes replaces the peer certificates; a header that does not decode
 * empties them, so the handler
 * falls through to the token path instead of trusting a transport identity
 * the proxy did not vouch for. The header is only honoured when forwarding is
 * enabled and the TCP peer lies in {@code trusted-sources}; otherwise it is
 * ignored and the transport state is left untouched.
 */
public final class ForwardedCertificateFilter implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardedCertificateFilter.class);

    private final ForwardedCertConfig config;
    private final TrustedSources trustedSources;
    private final ForwardedCertificateExtractor extractor;

    public ForwardedCertificateFilter(ForwardedCertConfig config, ForwardedCertificateExtractor extractor) {
        this.config = config;
        this.trustedSources = TrustedSources.parse(config.trustedSources());
        this.extractor = extractor;
        if (config.enabled() && trustedSources.isEmpty()) {
            LOG.warn("Forwarded client certificates are enabled but no trusted sources are configured; "
                    + "the {} header will be ignored", config.header());
        }
    }

    @Override
    public void handle(Context ctx) {
        String headerValue = ctx.header(config.header());
        if (headerValue == null || headerValue.isBlank()) {
            return;
        }

        String peer = ctx.req().getRemoteAddr();
        if (!config.enabled()) {
            LOG.warn("Ignoring {} header from {}: forwarded client certificates are disabled", config.header(), peer);
            return;
        }
        if (!trustedSources.contains(peer)) {
            LOG.warn("Ignoring {} header from untrusted source {}", config.header(), peer);
            return;
        }

        ConnectionSecurityContext security = ConnectionSecurityContext.resolve(ctx);
        try {
            X509Certificate certificate = extractor.extract(headerValue);
            security.useForwarded(certificate);
            LOG.debug("Forwarded client certificate accepted from {}: subject={}",
                    peer, certificate.getSubjectX500Principal().getName());
        } catch (CertificateParseException e) {
            security.reset();
            LOG.warn("Discarding forwarded client certificate from {}: {}", peer, e.getMessage());
        }
    }
}
