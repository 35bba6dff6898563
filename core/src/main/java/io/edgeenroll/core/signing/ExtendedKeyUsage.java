package io.edgeenroll.core.signing;

import java.util.Locale;
import java.util.Optional;
import org.bouncycastle.asn1.x509.KeyPurposeId;

/**
 * Extended key usages an edge node may request. Each constant carries the
 * numeric identifier used on the wire by existing edge agents, a kebab-case
 * name, and the X.509 key purpose it maps to.
 */
public enum ExtendedKeyUsage {
    ANY(0, "any", KeyPurposeId.anyExtendedKeyUsage),
    SERVER_AUTH(1, "server-auth", KeyPurposeId.id_kp_serverAuth),
    CLIENT_AUTH(2, "client-auth", KeyPurposeId.id_kp_clientAuth),
    CODE_SIGNING(3, "code-signing", KeyPurposeId.id_kp_codeSigning),
    EMAIL_PROTECTION(4, "email-protection", KeyPurposeId.id_kp_emailProtection),
    IPSEC_END_SYSTEM(5, "ipsec-end-system", KeyPurposeId.id_kp_ipsecEndSystem),
    IPSEC_TUNNEL(6, "ipsec-tunnel", KeyPurposeId.id_kp_ipsecTunnel),
    IPSEC_USER(7, "ipsec-user", KeyPurposeId.id_kp_ipsecUser),
    TIME_STAMPING(8, "time-stamping", KeyPurposeId.id_kp_timeStamping),
    OCSP_SIGNING(9, "ocsp-signing", KeyPurposeId.id_kp_OCSPSigning);

    private final int code;
    private final String wireName;
    private final KeyPurposeId keyPurpose;

    ExtendedKeyUsage(int code, String wireName, KeyPurposeId keyPurpose) {
        this.code = code;
        this.wireName = wireName;
        this.keyPurpose = keyPurpose;
    }

    public int code() {
        return code;
    }

    public String wireName() {
        return wireName;
    }

    public KeyPurposeId keyPurpose() {
        return keyPurpose;
    }

    /** Dotted OID string of the key purpose. */
    public String oid() {
        return keyPurpose.getId();
    }

    public static Optional<ExtendedKeyUsage> fromCode(int code) {
        for (ExtendedKeyUsage usage : values()) {
            if (usage.code == code) {
                return Optional.of(usage);
            }
        }
        return Optional.empty();
    }

    /** Accepts the kebab-case name or the enum constant name, case-insensitively. */
    public static Optional<ExtendedKeyUsage> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ExtendedKeyUsage usage : values()) {
            if (usage.wireName.equals(normalized)) {
                return Optional.of(usage);
            }
        }
        return Optional.empty();
    }
}
