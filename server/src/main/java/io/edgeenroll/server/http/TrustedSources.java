package io.edgeenroll.server.http;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * IPv4/IPv6 address ranges allowed to forward client certificates. Entries
 * are CIDR blocks ({@code 10.0.0.0/8}) or single addresses ({@code 10.1.2.3},
 * matched as a full-length prefix). Only IP literals are accepted; host names
 * are rejected rather than resolved.
 */
public final class TrustedSources {

    private final List<Range> ranges;

    private TrustedSources(List<Range> ranges) {
        this.ranges = ranges;
    }

    /**
     * @throws IllegalArgumentException if an entry is not a valid CIDR block or
     *                                  address
     */
    public static TrustedSources parse(List<String> entries) {
        List<Range> ranges = new ArrayList<>();
        for (String entry : entries) {
            if (entry != null && !entry.isBlank()) {
                ranges.add(Range.parse(entry.trim()));
            }
        }
        return new TrustedSources(List.copyOf(ranges));
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * @param address textual peer address, as returned by
     *                {@code ServletRequest.getRemoteAddr()}
     * @return whether the address lies in any range; unparseable addresses never
     *         match
     */
    public boolean contains(String address) {
        if (address == null || ranges.isEmpty()) {
            return false;
        }
        byte[] target;
        try {
            target = literal(address).getAddress();
        } catch (IllegalArgumentException e) {
            return false;
        }
        for (Range range : ranges) {
            if (range.matches(target)) {
                return true;
            }
        }
        return false;
    }

    private static InetAddress literal(String value) {
        String host = value.startsWith("[") && value.endsWith("]") ? value.substring(1, value.length() - 1) : value;
        if (!host.contains(":") && !host.matches("[0-9.]+")) {
            throw new IllegalArgumentException("Not an IP address literal: " + value);
        }
        try {
            return InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Not an IP address literal: " + value, e);
        }
    }

    private record Range(byte[] network, int prefixLength) {

        static Range parse(String entry) {
            int slash = entry.indexOf('/');
            byte[] network = literal(slash < 0 ? entry : entry.substring(0, slash)).getAddress();
            int maxPrefix = network.length * 8;
            int prefixLength = maxPrefix;
            if (slash >= 0) {
                try {
                    prefixLength = Integer.parseInt(entry.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid CIDR prefix: " + entry, e);
                }
            }
            if (prefixLength < 0 || prefixLength > maxPrefix) {
                throw new IllegalArgumentException("CIDR prefix out of range: " + entry);
            }
            return new Range(network, prefixLength);
        }

        boolean matches(byte[] target) {
            if (target.length != network.length) {
                return false;
            }
            for (int bit = 0; bit < prefixLength; bit++) {
                int mask = 0x80 >>> (bit % 8);
                if ((network[bit / 8] & mask) != (target[bit / 8] & mask)) {
                    return false;
                }
            }
            return true;
        }
    }
}
