package io.edgeenroll.server.config;

import java.util.List;

/**
 * Whether client certificates forwarded by a TLS-terminating proxy are
 * honoured, and from which hops ({@code server.forwarded-cert.*}).
 *
 * @param enabled        honour the header at all
 * @param header         request header carrying the base64 certificate
 * @param trustedSources CIDR ranges of proxies allowed to set the header,
 *                       matched against the TCP peer address; empty trusts
 *                       nobody
 */
public record ForwardedCertConfig(boolean enabled, String header, List<String> trustedSources) {

    public static final String DEFAULT_HEADER = "X-Forwarded-Client-Cert";

    public static final ForwardedCertConfig DISABLED = new ForwardedCertConfig(false, DEFAULT_HEADER, List.of());

    public ForwardedCertConfig {
        trustedSources = trustedSources == null ? List.of() : List.copyOf(trustedSources);
    }
}
