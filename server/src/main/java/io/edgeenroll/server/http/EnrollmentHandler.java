package io.edgeenroll.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.edgeenroll.core.error.AuthenticationException;
import io.edgeenroll.core.error.AuthenticationException.AuthPath;
import io.edgeenroll.core.error.SigningException;
import io.edgeenroll.core.signing.EdgeCertificateSigner;
import io.edgeenroll.core.signing.IssuedCertificate;
import io.edgeenroll.core.signing.SigningRequest;
import io.edgeenroll.core.token.BearerTokenValidator;
import io.edgeenroll.core.trust.NodeTrustVerifier;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Issues a certificate to an edge node.
 *
 * <p>
 * Authentication is an explicit two-branch decision: if the request carries a
 * peer certificate (from the TLS handshake or a trusted forwarding proxy) it
 * is judged by the {@link NodeTrustVerifier}; otherwise the
 * {@code Authorization} header is judged by the {@link BearerTokenValidator}.
 * Only then is the size-capped CSR body read and signed.
 *
 * <p>
 * Responses:
 * <ul>
 * <li>200: PEM of the issued certificate</li>
 * <li>401: authentication failed on either path</li>
 * <li>413: body larger than {@code server.max-body-bytes}; the signer is not
 * called</li>
 * <li>500: usages header or CSR unusable, or the CA primitive failed</li>
 * </ul>
 *
 * <p>
 * Thread-safe: all per-request state is local to {@link #handle(Context)}.
 */
public final class EnrollmentHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(EnrollmentHandler.class);

    public static final String NODE_NAME_HEADER = "Node-Name";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String EXT_KEY_USAGES_HEADER = "Ext-Key-Usages";
    public static final String PEM_CONTENT_TYPE = "application/x-pem-file";

    static final String MDC_NODE_NAME = "nodeName";
    static final String MDC_AUTH_PATH = "authPath";

    private final NodeTrustVerifier trustVerifier;
    private final BearerTokenValidator tokenValidator;
    private final EdgeCertificateSigner signer;
    private final int maxBodyBytes;

    public EnrollmentHandler(
            NodeTrustVerifier trustVerifier,
            BearerTokenValidator tokenValidator,
            EdgeCertificateSigner signer,
            int maxBodyBytes) {
        this.trustVerifier = trustVerifier;
        this.tokenValidator = tokenValidator;
        this.signer = signer;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(Context ctx) {
        String nodeName = ctx.header(NODE_NAME_HEADER);
        MDC.put(MDC_NODE_NAME, nodeName == null ? "" : nodeName);
        try {
            AuthPath authPath = authenticate(ctx, nodeName);
            IssuedCertificate issued = issue(ctx, nodeName);

            X509Certificate certificate = issued.certificate();
            LOG.info(
                    "Issued certificate to node {} via {} path: serial={}, notAfter={}",
                    nodeName,
                    authPath.label(),
                    certificate.getSerialNumber().toString(16),
                    certificate.getNotAfter().toInstant());
            ctx.status(200);
            ctx.contentType(PEM_CONTENT_TYPE);
            ctx.result(issued.pemBytes());
        } catch (AuthenticationException e) {
            LOG.warn("Rejected node {} on {} path: {}", nodeName, e.authPath().label(), e.getMessage());
            String detail = e.authPath() == AuthPath.CERTIFICATE
                    ? "failed to verify certificate for node " + nodeName + ": " + e.getMessage()
                    : "failed to validate token for node " + nodeName + ": " + e.getMessage();
            writeProblem(ctx, e.statusCode(), ProblemDetail.unauthorized(detail, ctx.path()));
        } catch (PayloadTooLargeException e) {
            LOG.warn("Rejected CSR from node {}: {}", nodeName, e.getMessage());
            writeProblem(ctx, 413, ProblemDetail.payloadTooLarge(e.getMessage(), ctx.path()));
        } catch (SigningException e) {
            LOG.error("Signing failed for node {}: {}", nodeName, e.getMessage(), e);
            writeProblem(
                    ctx,
                    500,
                    ProblemDetail.signingFailed(
                            "failed to sign certificate for node " + nodeName + ": " + e.getMessage(), ctx.path()));
        } finally {
            MDC.remove(MDC_AUTH_PATH);
            MDC.remove(MDC_NODE_NAME);
        }
    }

    private AuthPath authenticate(Context ctx, String nodeName) {
        ConnectionSecurityContext security = ConnectionSecurityContext.resolve(ctx);
        if (security.hasPeerCertificate()) {
            MDC.put(MDC_AUTH_PATH, AuthPath.CERTIFICATE.label());
            trustVerifier.verify(security.peerCertificates().get(0), nodeName);
            LOG.info("Node {} authenticated by {} certificate", nodeName, security.source().name().toLowerCase(Locale.ROOT));
            return AuthPath.CERTIFICATE;
        }
        MDC.put(MDC_AUTH_PATH, AuthPath.TOKEN.label());
        tokenValidator.validate(ctx.header(AUTHORIZATION_HEADER), nodeName);
        LOG.info("Node {} authenticated by bearer token", nodeName);
        return AuthPath.TOKEN;
    }

    private IssuedCertificate issue(Context ctx, String nodeName) {
        byte[] csr;
        try {
            csr = BoundedBodyReader.read(ctx.bodyInputStream(), ctx.req().getContentLengthLong(), maxBodyBytes);
        } catch (IOException e) {
            throw new SigningException("fail to read request body: " + e.getMessage(), e, nodeName);
        }
        SigningRequest request = signer.newRequest(csr, ctx.header(EXT_KEY_USAGES_HEADER));
        return signer.sign(request);
    }

    private static void writeProblem(Context ctx, int statusCode, JsonNode problem) {
        ctx.status(statusCode);
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(problem.toString());
    }
}
