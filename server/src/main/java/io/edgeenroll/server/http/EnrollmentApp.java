package io.edgeenroll.server.http;

import io.edgeenroll.core.evidence.ForwardedCertificateExtractor;
import io.edgeenroll.core.pki.RootOfTrust;
import io.edgeenroll.core.signing.BouncyCastleCsrSigner;
import io.edgeenroll.core.signing.EdgeCertificateSigner;
import io.edgeenroll.core.token.BearerTokenValidator;
import io.edgeenroll.core.token.JwtTokenVerifier;
import io.edgeenroll.core.trust.NodeTrustVerifier;
import io.edgeenroll.core.trust.SubjectPolicy;
import io.edgeenroll.server.config.ConfigLoadException;
import io.edgeenroll.server.config.ConfigLoader;
import io.edgeenroll.server.config.GatewayConfig;
import io.javalin.Javalin;
import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates gateway startup.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Validate TLS configuration</li>
 * <li>Load the root of trust</li>
 * <li>Wire the verifier, token validator and signer</li>
 * <li>Register routes and start Javalin</li>
 * </ol>
 *
 * <p>
 * Kept separate from {@link io.edgeenroll.server.EnrollmentMain} so tests can
 * start the gateway without going through {@code main()}.
 */
public final class EnrollmentApp {

    private static final Logger LOG = LoggerFactory.getLogger(EnrollmentApp.class);

    private final Javalin app;
    private final GatewayConfig config;
    private final RootOfTrust rootOfTrust;

    private EnrollmentApp(Javalin app, GatewayConfig config, RootOfTrust rootOfTrust) {
        this.app = app;
        this.config = config;
        this.rootOfTrust = rootOfTrust;
    }

    /**
     * Loads configuration from the command line and starts the gateway.
     *
     * @param args command-line arguments (e.g. {@code --config gateway.yaml})
     * @return the running gateway
     */
    public static EnrollmentApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        GatewayConfig config = ConfigLoader.load(configPath);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);

        return start(config);
    }

    /**
     * Starts the gateway from an already-loaded configuration.
     *
     * @param config the configuration
     * @return the running gateway
     * @throws ConfigLoadException   if the CA material cannot be loaded or a
     *                               setting is out of range
     * @throws IllegalStateException if the TLS configuration is invalid
     */
    public static EnrollmentApp start(GatewayConfig config) {
        long startTime = System.nanoTime();

        if (config.validityDays() <= 0) {
            throw new ConfigLoadException(
                    "signing.validity-days must be positive but was " + config.validityDays());
        }
        if (config.maxBodyBytes() <= 0) {
            throw new ConfigLoadException(
                    "server.max-body-bytes must be positive but was " + config.maxBodyBytes());
        }
        TlsConfigValidator.validateInbound(config.tls());
        RootOfTrust rootOfTrust = loadRootOfTrust(config);

        NodeTrustVerifier trustVerifier =
                new NodeTrustVerifier(rootOfTrust, new SubjectPolicy(config.legacySubjectEnabled()));
        BearerTokenValidator tokenValidator = new BearerTokenValidator(rootOfTrust, new JwtTokenVerifier());
        EdgeCertificateSigner signer =
                new EdgeCertificateSigner(rootOfTrust, new BouncyCastleCsrSigner(), config.validityDays());
        ForwardedCertificateFilter forwardedCertificateFilter =
                new ForwardedCertificateFilter(config.forwardedCert(), new ForwardedCertificateExtractor());
        EnrollmentHandler enrollmentHandler =
                new EnrollmentHandler(trustVerifier, tokenValidator, signer, config.maxBodyBytes());

        if (config.legacySubjectEnabled()) {
            LOG.warn("Legacy subject rule is enabled: certificates with O={}, CN={} are accepted for any node",
                    SubjectPolicy.LEGACY_ORGANIZATION, SubjectPolicy.LEGACY_COMMON_NAME);
        }

        Javalin app = Javalin.create(javalinConfig -> {
            if (config.tls().enabled()) {
                TlsConfigurator.configureInboundTls(javalinConfig, config.tls(), config.host(), config.port());
            }
        });

        app.before(config.enrollPath(), forwardedCertificateFilter);
        app.post(config.enrollPath(), enrollmentHandler);
        app.get(config.caPath(), new CaCertificateHandler(rootOfTrust));
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler(rootOfTrust));
        }
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            ctx.status(500);
            ctx.contentType(ProblemDetail.CONTENT_TYPE);
            ctx.result(ProblemDetail.internalError("unexpected error: " + e.getMessage(), ctx.path())
                    .toString());
        });

        if (config.tls().enabled()) {
            app.start();
        } else {
            app.start(config.host(), config.port());
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "edge-enrollment-gateway started: port={}, tls={}, ca={}, caHash={}, validityDays={}, "
                        + "forwardedCert={}, startupMs={}",
                app.port(),
                config.tls().enabled() ? config.tls().clientAuth() : "off",
                rootOfTrust.caCertificate().getSubjectX500Principal().getName(),
                rootOfTrust.caHash(),
                config.validityDays(),
                config.forwardedCert().enabled(),
                elapsedMs);

        return new EnrollmentApp(app, config, rootOfTrust);
    }

    private static RootOfTrust loadRootOfTrust(GatewayConfig config) {
        try {
            return RootOfTrust.load(Path.of(config.caCertFile()), Path.of(config.caKeyFile()));
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigLoadException("Cannot load CA from " + config.caCertFile() + " and "
                    + config.caKeyFile() + ": " + e.getMessage(), e);
        }
    }

    /** Returns the port the gateway is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public GatewayConfig config() {
        return config;
    }

    public RootOfTrust rootOfTrust() {
        return rootOfTrust;
    }

    public void stop() {
        app.stop();
        LOG.info("edge-enrollment-gateway stopped");
    }
}
