package io.edgeenroll.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds RFC 9457 Problem Details bodies for gateway errors.
 *
 * <pre>{@code
 * {
 * "type": "urn:edge-enrollment:unauthorized",
 * "title": "Unauthorized",
 * "status": 401,
 * "detail": "failed to verify certificate for node edge1: chain verification failed: ...",
 * "instance": "/edge.crt"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    /** Media type of every error body. */
    public static final String CONTENT_TYPE = "application/problem+json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_UNAUTHORIZED = "urn:edge-enrollment:unauthorized";
    static final String URN_PAYLOAD_TOO_LARGE = "urn:edge-enrollment:payload-too-large";
    static final String URN_SIGNING_FAILED = "urn:edge-enrollment:signing-failed";
    static final String URN_INTERNAL_ERROR = "urn:edge-enrollment:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** Authentication on either path failed (401). */
    public static JsonNode unauthorized(String detail, String instancePath) {
        return build(URN_UNAUTHORIZED, "Unauthorized", 401, detail, instancePath);
    }

    /** CSR body exceeds {@code server.max-body-bytes} (413). */
    public static JsonNode payloadTooLarge(String detail, String instancePath) {
        return build(URN_PAYLOAD_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /** The certificate could not be issued (500). */
    public static JsonNode signingFailed(String detail, String instancePath) {
        return build(URN_SIGNING_FAILED, "Certificate Signing Failed", 500, detail, instancePath);
    }

    /** Anything unexpected (500). */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
