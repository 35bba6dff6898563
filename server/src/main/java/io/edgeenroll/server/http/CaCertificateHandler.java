package io.edgeenroll.server.http;

import io.edgeenroll.core.pki.RootOfTrust;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Public CA discovery endpoint: returns the DER bytes of the CA certificate.
 * No authentication; edge nodes pin it against the hash in their join token.
 */
public final class CaCertificateHandler implements Handler {

    public static final String DER_CONTENT_TYPE = "application/octet-stream";

    private final byte[] caCertificateDer;

    public CaCertificateHandler(RootOfTrust rootOfTrust) {
        this.caCertificateDer = rootOfTrust.caCertificateDer();
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType(DER_CONTENT_TYPE);
        ctx.result(caCertificateDer.clone());
    }
}
