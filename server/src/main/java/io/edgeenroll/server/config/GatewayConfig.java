package io.edgeenroll.server.config;

/**
 * Root configuration of the enrollment gateway.
 *
 * <p>
 * Built once at startup and handed to each component; never mutated. All
 * fields have defaults except the CA file paths, which {@link ConfigLoader}
 * requires. Use {@link #builder()} to construct instances.
 *
 * @param host                 bind address
 * @param port                 listen port
 * @param maxBodyBytes         largest accepted CSR body
 * @param caPath               path of the CA discovery endpoint
 * @param enrollPath           path of the enrollment endpoint
 * @param caCertFile           CA certificate file (PEM or DER)
 * @param caKeyFile            CA private key file (PEM)
 * @param validityDays         lifetime of issued certificates in days
 * @param legacySubjectEnabled accept the legacy {@code O=KubeEdge,
 *                             CN=kubeedge.io} subject for any node
 * @param healthEnabled        expose the health endpoint
 * @param healthPath           path of the health endpoint
 * @param loggingFormat        {@code json} or {@code text}
 * @param loggingLevel         root log level
 * @param tls                  inbound TLS configuration
 * @param forwardedCert        forwarded client certificate handling
 */
public record GatewayConfig(
        String host,
        int port,
        int maxBodyBytes,
        String caPath,
        String enrollPath,
        String caCertFile,
        String caKeyFile,
        int validityDays,
        boolean legacySubjectEnabled,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        TlsConfig tls,
        ForwardedCertConfig forwardedCert) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GatewayConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 10002;
        private int maxBodyBytes = 1_048_576; // 1 MiB
        private String caPath = "/ca.crt";
        private String enrollPath = "/edge.crt";
        private String caCertFile;
        private String caKeyFile;
        private int validityDays = 365;
        private boolean legacySubjectEnabled = true;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private TlsConfig tls = TlsConfig.DISABLED;
        private ForwardedCertConfig forwardedCert = ForwardedCertConfig.DISABLED;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder caPath(String caPath) {
            this.caPath = caPath;
            return this;
        }

        public Builder enrollPath(String enrollPath) {
            this.enrollPath = enrollPath;
            return this;
        }

        public Builder caCertFile(String caCertFile) {
            this.caCertFile = caCertFile;
            return this;
        }

        public Builder caKeyFile(String caKeyFile) {
            this.caKeyFile = caKeyFile;
            return this;
        }

        public Builder validityDays(int validityDays) {
            this.validityDays = validityDays;
            return this;
        }

        public Builder legacySubjectEnabled(boolean legacySubjectEnabled) {
            this.legacySubjectEnabled = legacySubjectEnabled;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder tls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        public Builder forwardedCert(ForwardedCertConfig forwardedCert) {
            this.forwardedCert = forwardedCert;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(
                    host,
                    port,
                    maxBodyBytes,
                    caPath,
                    enrollPath,
                    caCertFile,
                    caKeyFile,
                    validityDays,
                    legacySubjectEnabled,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    tls,
                    forwardedCert);
        }
    }
}
