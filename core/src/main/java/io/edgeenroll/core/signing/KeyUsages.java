package io.edgeenroll.core.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.edgeenroll.core.error.SigningException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parses the {@code Ext-Key-Usages} header: a JSON array of numeric usage
 * identifiers or kebab-case names, e.g. {@code [2]} or
 * {@code ["server-auth","client-auth"]}.
 */
public final class KeyUsages {

    /** Usages applied when the caller asks for none. */
    public static final Set<ExtendedKeyUsage> DEFAULT = Collections.unmodifiableSet(EnumSet.of(ExtendedKeyUsage.CLIENT_AUTH));

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private KeyUsages() {
        // utility class
    }

    /**
     * Parses a header value.
     *
     * @param headerValue the raw header, {@code null} or empty for the default
     * @return an unmodifiable, non-empty usage set
     * @throws SigningException if the value is not a JSON array of known usages
     */
    public static Set<ExtendedKeyUsage> parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return DEFAULT;
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(headerValue);
        } catch (JsonProcessingException e) {
            throw new SigningException("unmarshal http header Ext-Key-Usages failed: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new SigningException("unmarshal http header Ext-Key-Usages failed: expected a JSON array");
        }

        Set<ExtendedKeyUsage> usages = EnumSet.noneOf(ExtendedKeyUsage.class);
        for (JsonNode element : root) {
            usages.add(toUsage(element));
        }
        return usages.isEmpty() ? DEFAULT : Collections.unmodifiableSet(usages);
    }

    private static ExtendedKeyUsage toUsage(JsonNode element) {
        if (element.isIntegralNumber()) {
            if (!element.canConvertToInt()) {
                throw new SigningException("unknown extended key usage code: " + element);
            }
            return ExtendedKeyUsage.fromCode(element.intValue())
                    .orElseThrow(() -> new SigningException("unknown extended key usage code: " + element));
        }
        if (element.isTextual()) {
            return ExtendedKeyUsage.fromName(element.asText())
                    .orElseThrow(() -> new SigningException("unknown extended key usage name: " + element));
        }
        throw new SigningException("extended key usage must be a number or a string, got: " + element);
    }
}
