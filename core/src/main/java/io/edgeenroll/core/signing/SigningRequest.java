package io.edgeenroll.core.signing;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One certificate-signing request, consumed once by
 * {@link EdgeCertificateSigner#sign(SigningRequest)}.
 *
 * @param csr      raw PKCS#10 bytes as received
 * @param usages   requested extended key usages; empty means
 *                 {@link KeyUsages#DEFAULT}
 * @param validity lifetime of the certificate to issue
 */
public record SigningRequest(byte[] csr, Set<ExtendedKeyUsage> usages, Duration validity) {

    public SigningRequest {
        Objects.requireNonNull(csr, "csr");
        Objects.requireNonNull(validity, "validity");
        usages = usages == null || usages.isEmpty()
                ? KeyUsages.DEFAULT
                : Collections.unmodifiableSet(EnumSet.copyOf(usages));
    }
}
