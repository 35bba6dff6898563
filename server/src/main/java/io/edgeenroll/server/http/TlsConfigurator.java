package io.edgeenroll.server.http;

import io.edgeenroll.server.config.TlsConfig;
import io.javalin.config.JavalinConfig;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces Javalin's plain HTTP connector with an HTTPS one.
 *
 * <p>
 * Client certificates accepted during the handshake are exposed by Jetty's
 * {@link SecureRequestCustomizer} as the
 * {@code jakarta.servlet.request.X509Certificate} request attribute, which
 * {@link ConnectionSecurityContext} picks up. Certificates are checked against
 * the truststore during the handshake; the enrollment handler verifies them
 * again against the root of trust.
 */
public final class TlsConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigurator.class);

    private TlsConfigurator() {}

    /**
     * Adds the HTTPS connector. Because a connector is registered, Javalin adds
     * no default one, so the connector carries the bind address itself.
     *
     * @param javalinConfig the Javalin configuration to modify
     * @param tlsConfig     the inbound TLS configuration
     * @param host          bind address
     * @param port          listen port, 0 for ephemeral
     */
    public static void configureInboundTls(JavalinConfig javalinConfig, TlsConfig tlsConfig, String host, int port) {
        javalinConfig.jetty.addConnector((server, httpConfig) -> {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();

            sslContextFactory.setKeyStorePath(tlsConfig.keystore());
            sslContextFactory.setKeyStorePassword(tlsConfig.keystorePassword());
            sslContextFactory.setKeyStoreType(tlsConfig.keystoreType());

            switch (tlsConfig.clientAuth()) {
                case "need" -> {
                    sslContextFactory.setNeedClientAuth(true);
                    configureTruststore(sslContextFactory, tlsConfig);
                }
                case "want" -> {
                    sslContextFactory.setWantClientAuth(true);
                    configureTruststore(sslContextFactory, tlsConfig);
                }
                default -> {
                    // "none": token path only
                }
            }

            HttpConfiguration httpsConfig = new HttpConfiguration(httpConfig);
            httpsConfig.addCustomizer(new SecureRequestCustomizer());

            ServerConnector sslConnector = new ServerConnector(
                    server,
                    new SslConnectionFactory(sslContextFactory, "http/1.1"),
                    new HttpConnectionFactory(httpsConfig));
            sslConnector.setHost(host);
            sslConnector.setPort(port);

            LOG.info(
                    "Inbound TLS configured: keystore={}, keystoreType={}, clientAuth={}",
                    tlsConfig.keystore(),
                    tlsConfig.keystoreType(),
                    tlsConfig.clientAuth());

            return sslConnector;
        });
    }

    private static void configureTruststore(SslContextFactory.Server sslContextFactory, TlsConfig tlsConfig) {
        if (tlsConfig.truststore() != null) {
            sslContextFactory.setTrustStorePath(tlsConfig.truststore());
            sslContextFactory.setTrustStorePassword(tlsConfig.truststorePassword());
            sslContextFactory.setTrustStoreType(tlsConfig.truststoreType());
        }
    }
}
