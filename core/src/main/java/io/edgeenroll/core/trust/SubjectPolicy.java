package io.edgeenroll.core.trust;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;

/**
 * Subject naming rules a node certificate must satisfy. Rules are tried in
 * order and the first match wins:
 *
 * <ol>
 * <li>Legacy: {@code O=KubeEdge, CN=kubeedge.io}, accepted for any node name.
 * Only active while {@link #legacyEnabled()} is set; kept for certificates
 * issued before per-node subjects existed and slated for removal.</li>
 * <li>Current: {@code O=system:nodes, CN=system:node:<nodeName>}.</li>
 * </ol>
 *
 * <p>
 * Only the first organization value is consulted. A subject with no
 * organization never matches.
 *
 * @param legacyEnabled whether the legacy subject rule is active
 */
public record SubjectPolicy(boolean legacyEnabled) {

    public static final String LEGACY_ORGANIZATION = "KubeEdge";
    public static final String LEGACY_COMMON_NAME = "kubeedge.io";
    public static final String NODES_ORGANIZATION = "system:nodes";
    public static final String NODE_COMMON_NAME_PREFIX = "system:node:";

    /** Policy with the legacy rule enabled. */
    public static final SubjectPolicy DEFAULT = new SubjectPolicy(true);

    /** Outcome of a policy check. */
    public enum Match {
        LEGACY,
        NODE,
        NONE
    }

    /**
     * Evaluates the certificate subject against the claimed node name.
     *
     * @param certificate the peer certificate
     * @param nodeName    the claimed node name (may be {@code null})
     * @return which rule matched, or {@link Match#NONE}
     */
    public Match evaluate(X509Certificate certificate, String nodeName) {
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        List<String> organizations = values(subject, BCStyle.O);
        if (organizations.isEmpty()) {
            return Match.NONE;
        }
        String organization = organizations.get(0);
        List<String> commonNames = values(subject, BCStyle.CN);
        String commonName = commonNames.isEmpty() ? null : commonNames.get(commonNames.size() - 1);

        if (legacyEnabled && LEGACY_ORGANIZATION.equals(organization) && LEGACY_COMMON_NAME.equals(commonName)) {
            return Match.LEGACY;
        }
        if (nodeName != null && NODES_ORGANIZATION.equals(organization) && (NODE_COMMON_NAME_PREFIX + nodeName).equals(commonName)) {
            return Match.NODE;
        }
        return Match.NONE;
    }

    private static List<String> values(X500Name name, ASN1ObjectIdentifier type) {
        List<String> values = new ArrayList<>();
        for (RDN rdn : name.getRDNs(type)) {
            for (AttributeTypeAndValue attribute : rdn.getTypesAndValues()) {
                if (!type.equals(attribute.getType())) {
                    continue;
                }
                // raw attribute text, not the RFC 4514 escaped form
                ASN1Encodable value = attribute.getValue();
                values.add(value instanceof ASN1String text ? text.getString() : value.toString());
            }
        }
        return values;
    }
}
