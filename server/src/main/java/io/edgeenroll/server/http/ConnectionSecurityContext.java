package io.edgeenroll.server.http;

import io.javalin.http.Context;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Peer certificates available to the current request, either from the TLS
 * handshake or from a forwarded certificate header.
 *
 * <p>
 * One instance per request, stored as a {@link Context} attribute and never
 * on the connection, so nothing leaks to a later request on a reused
 * connection.
 */
public final class ConnectionSecurityContext {

    static final String ATTRIBUTE = ConnectionSecurityContext.class.getName();

    /** Set by Jetty's {@code SecureRequestCustomizer} when the client presented a certificate. */
    static final String SERVLET_CERTIFICATE_ATTRIBUTE = "jakarta.servlet.request.X509Certificate";

    /** Where the peer certificates came from. */
    public enum Source {
        NONE,
        TRANSPORT,
        FORWARDED
    }

    private List<X509Certificate> peerCertificates;
    private Source source;

    private ConnectionSecurityContext(List<X509Certificate> peerCertificates, Source source) {
        this.peerCertificates = peerCertificates;
        this.source = source;
    }

    /**
     * Returns the request's context, creating it from the transport state on
     * first access.
     */
    public static ConnectionSecurityContext resolve(Context ctx) {
        ConnectionSecurityContext existing = ctx.attribute(ATTRIBUTE);
        if (existing != null) {
            return existing;
        }
        ConnectionSecurityContext created = fromTransport(ctx.req().getAttribute(SERVLET_CERTIFICATE_ATTRIBUTE));
        ctx.attribute(ATTRIBUTE, created);
        return created;
    }

    static ConnectionSecurityContext fromTransport(Object servletAttribute) {
        if (servletAttribute instanceof X509Certificate[] chain && chain.length > 0) {
            return new ConnectionSecurityContext(List.of(chain), Source.TRANSPORT);
        }
        return empty();
    }

    static ConnectionSecurityContext empty() {
        return new ConnectionSecurityContext(List.of(), Source.NONE);
    }

    /** Replaces whatever the transport provided with the forwarded certificate. */
    public void useForwarded(X509Certificate certificate) {
        this.peerCertificates = List.of(certificate);
        this.source = Source.FORWARDED;
    }

    /** Drops all peer certificates, including a genuine transport one. */
    public void reset() {
        this.peerCertificates = List.of();
        this.source = Source.NONE;
    }

    public List<X509Certificate> peerCertificates() {
        return peerCertificates;
    }

    public boolean hasPeerCertificate() {
        return !peerCertificates.isEmpty();
    }

    public Source source() {
        return source;
    }
}
