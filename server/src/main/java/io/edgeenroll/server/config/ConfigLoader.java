package io.edgeenroll.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link GatewayConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code edge-enrollment-gateway.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults of {@link GatewayConfig.Builder}. Every
 * key can be overridden by an environment variable (see
 * {@link #applyEnvOverrides}); env vars take precedence over YAML values. An
 * env var is "set" if and only if it is defined and its trimmed value is
 * non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "edge-enrollment-gateway.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file, applying overrides from
     * {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, invalid, or lacks a
     *                             required key
     */
    public static GatewayConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given file, applying overrides from the
     * supplied lookup function. Returning {@code null} means the variable is
     * not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, invalid, or lacks a
     *                             required key
     */
    public static GatewayConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        GatewayConfig config;
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Failed to load configuration from: " + configPath + " (" + e.getMessage() + ")", e);
        }

        requireSet(config.caCertFile(), "ca.cert-file", "CA_CERT_FILE");
        requireSet(config.caKeyFile(), "ca.key-file", "CA_KEY_FILE");
        return config;
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GatewayConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        GatewayConfig.Builder builder = GatewayConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());
        if (server.has("max-body-bytes")) builder.maxBodyBytes(server.get("max-body-bytes").asInt());
        if (server.has("ca-path")) builder.caPath(server.get("ca-path").asText());
        if (server.has("enroll-path")) builder.enrollPath(server.get("enroll-path").asText());

        JsonNode tls = server.path("tls");
        TlsConfig defaults = TlsConfig.DISABLED;
        TlsConfig yamlTls = new TlsConfig(
                boolOrDefault(tls, "enabled", defaults.enabled()),
                textOrDefault(tls, "keystore", defaults.keystore()),
                textOrDefault(tls, "keystore-password", defaults.keystorePassword()),
                textOrDefault(tls, "keystore-type", defaults.keystoreType()),
                textOrDefault(tls, "client-auth", defaults.clientAuth()),
                textOrDefault(tls, "truststore", defaults.truststore()),
                textOrDefault(tls, "truststore-password", defaults.truststorePassword()),
                textOrDefault(tls, "truststore-type", defaults.truststoreType()));

        JsonNode forwarded = server.path("forwarded-cert");
        ForwardedCertConfig yamlForwarded = new ForwardedCertConfig(
                boolOrDefault(forwarded, "enabled", false),
                textOrDefault(forwarded, "header", ForwardedCertConfig.DEFAULT_HEADER),
                listOrEmpty(forwarded, "trusted-sources"));

        JsonNode ca = root.path("ca");
        if (ca.has("cert-file")) builder.caCertFile(ca.get("cert-file").asText());
        if (ca.has("key-file")) builder.caKeyFile(ca.get("key-file").asText());

        JsonNode signing = root.path("signing");
        if (signing.has("validity-days")) builder.validityDays(signing.get("validity-days").asInt());
        if (signing.has("legacy-subject-enabled"))
            builder.legacySubjectEnabled(signing.get("legacy-subject-enabled").asBoolean());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup, yamlTls, yamlForwarded);
        return builder.build();
    }

    /**
     * Applies environment variable overrides. Nested records are immutable, so
     * they are rebuilt from their YAML values with any overrides applied.
     */
    private static void applyEnvOverrides(
            GatewayConfig.Builder builder,
            Function<String, String> envLookup,
            TlsConfig yamlTls,
            ForwardedCertConfig yamlForwarded) {

        envString(envLookup, "SERVER_HOST", builder::host);
        envString(envLookup, "SERVER_CA_PATH", builder::caPath);
        envString(envLookup, "SERVER_ENROLL_PATH", builder::enrollPath);
        envString(envLookup, "CA_CERT_FILE", builder::caCertFile);
        envString(envLookup, "CA_KEY_FILE", builder::caKeyFile);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SERVER_PORT", builder::port);
        envInt(envLookup, "SERVER_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "SIGNING_VALIDITY_DAYS", builder::validityDays);

        envBool(envLookup, "SIGNING_LEGACY_SUBJECT_ENABLED", builder::legacySubjectEnabled);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);

        builder.tls(new TlsConfig(
                envBoolOrDefault(envLookup, "SERVER_TLS_ENABLED", yamlTls.enabled()),
                envStringOrDefault(envLookup, "SERVER_TLS_KEYSTORE", yamlTls.keystore()),
                envStringOrDefault(envLookup, "SERVER_TLS_KEYSTORE_PASSWORD", yamlTls.keystorePassword()),
                envStringOrDefault(envLookup, "SERVER_TLS_KEYSTORE_TYPE", yamlTls.keystoreType()),
                envStringOrDefault(envLookup, "SERVER_TLS_CLIENT_AUTH", yamlTls.clientAuth()),
                envStringOrDefault(envLookup, "SERVER_TLS_TRUSTSTORE", yamlTls.truststore()),
                envStringOrDefault(envLookup, "SERVER_TLS_TRUSTSTORE_PASSWORD", yamlTls.truststorePassword()),
                envStringOrDefault(envLookup, "SERVER_TLS_TRUSTSTORE_TYPE", yamlTls.truststoreType())));

        // Trusted sources come in as a comma-separated list
        List<String> trustedSources = yamlForwarded.trustedSources();
        if (isSet(envLookup, "FORWARDED_CERT_TRUSTED_SOURCES")) {
            trustedSources = splitList(envLookup.apply("FORWARDED_CERT_TRUSTED_SOURCES"));
        }
        builder.forwardedCert(new ForwardedCertConfig(
                envBoolOrDefault(envLookup, "FORWARDED_CERT_ENABLED", yamlForwarded.enabled()),
                envStringOrDefault(envLookup, "FORWARDED_CERT_HEADER", yamlForwarded.header()),
                trustedSources));
    }

    private static void requireSet(String value, String key, String envVar) {
        if (value == null || value.isBlank()) {
            throw new ConfigLoadException(
                    "Missing required configuration: " + key + " (or environment variable " + envVar + ")");
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Environment variable " + envVar + " is not an integer: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    private static boolean envBoolOrDefault(Function<String, String> envLookup, String envVar, boolean yamlDefault) {
        return isSet(envLookup, envVar) ? Boolean.parseBoolean(envLookup.apply(envVar).trim()) : yamlDefault;
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : defaultValue;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }

    /** Accepts a YAML sequence or a single comma-separated string. */
    private static List<String> listOrEmpty(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isArray()) {
            List<String> items = new ArrayList<>();
            value.forEach(item -> items.add(item.asText().trim()));
            return items;
        }
        if (value.isTextual()) {
            return splitList(value.asText());
        }
        return List.of();
    }
}
