package io.edgeenroll.server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.edgeenroll.core.pki.RootOfTrust;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness probe. Returns {@code 200} with {@code status: UP} plus the CA
 * subject and expiry, so monitoring can alert before the root of trust lapses.
 */
public final class HealthHandler implements Handler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String body;

    public HealthHandler(RootOfTrust rootOfTrust) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("status", "UP");
        node.put("caSubject", rootOfTrust.caCertificate().getSubjectX500Principal().getName());
        node.put("caNotAfter", rootOfTrust.caCertificate().getNotAfter().toInstant().toString());
        this.body = node.toString();
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body);
    }
}
