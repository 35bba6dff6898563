package io.edgeenroll.server.config;

/**
 * Inbound TLS configuration ({@code server.tls.*}).
 *
 * @param enabled            serve HTTPS instead of plain HTTP
 * @param keystore           path to the server certificate keystore
 * @param keystorePassword   keystore password
 * @param keystoreType       PKCS12 or JKS
 * @param clientAuth         {@code none}, {@code want} or {@code need}
 * @param truststore         CA truststore for client certificates
 * @param truststorePassword truststore password
 * @param truststoreType     PKCS12 or JKS
 */
public record TlsConfig(
        boolean enabled,
        String keystore,
        String keystorePassword,
        String keystoreType,
        String clientAuth,
        String truststore,
        String truststorePassword,
        String truststoreType) {

    /** TLS disabled. Client auth defaults to {@code want} so token-path clients can still connect once enabled. */
    public static final TlsConfig DISABLED = new TlsConfig(false, null, null, "PKCS12", "want", null, null, "PKCS12");
}
