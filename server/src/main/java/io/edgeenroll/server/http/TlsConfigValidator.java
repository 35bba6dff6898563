package io.edgeenroll.server.http;

import io.edgeenroll.server.config.TlsConfig;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates inbound TLS configuration at startup, so a bad keystore path or
 * password fails with a descriptive message before the server binds.
 */
public final class TlsConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigValidator.class);

    private static final Set<String> CLIENT_AUTH_MODES = Set.of("none", "want", "need");

    private TlsConfigValidator() {}

    /**
     * @param tlsConfig the inbound TLS configuration to validate
     * @throws IllegalStateException if any setting is invalid
     */
    public static void validateInbound(TlsConfig tlsConfig) {
        if (!tlsConfig.enabled()) {
            return;
        }

        if (tlsConfig.keystore() == null || tlsConfig.keystore().isBlank()) {
            throw new IllegalStateException("Inbound TLS enabled but no keystore path configured. "
                    + "Set server.tls.keystore to a valid PKCS12 or JKS keystore file.");
        }
        if (!CLIENT_AUTH_MODES.contains(tlsConfig.clientAuth())) {
            throw new IllegalStateException("server.tls.client-auth must be one of " + CLIENT_AUTH_MODES
                    + " but was '" + tlsConfig.clientAuth() + "'");
        }

        verifyKeystore(
                "Inbound TLS keystore", tlsConfig.keystore(), tlsConfig.keystorePassword(), tlsConfig.keystoreType());

        if ("need".equals(tlsConfig.clientAuth()) || "want".equals(tlsConfig.clientAuth())) {
            if (tlsConfig.truststore() == null || tlsConfig.truststore().isBlank()) {
                throw new IllegalStateException("server.tls.client-auth=" + tlsConfig.clientAuth()
                        + " requires a truststore for client certificate validation. "
                        + "Set server.tls.truststore to a truststore holding the edge CA.");
            }
            verifyKeystore(
                    "Inbound mTLS truststore",
                    tlsConfig.truststore(),
                    tlsConfig.truststorePassword(),
                    tlsConfig.truststoreType());
        }

        LOG.info("Inbound TLS configuration validated successfully");
    }

    private static void verifyKeystore(String label, String path, String password, String type) {
        Path storePath = Path.of(path);

        if (!Files.exists(storePath)) {
            throw new IllegalStateException(label + " file does not exist: " + path);
        }
        if (!Files.isReadable(storePath)) {
            throw new IllegalStateException(label + " file is not readable: " + path);
        }

        try {
            KeyStore ks = KeyStore.getInstance(type);
            try (InputStream is = Files.newInputStream(storePath)) {
                ks.load(is, password != null ? password.toCharArray() : null);
            }
        } catch (Exception e) {
            throw new IllegalStateException(
                    label + " could not be loaded (wrong password or corrupt file?): " + path + ": " + e.getMessage(),
                    e);
        }
    }
}
