package org.smileyface.minespec.safety;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies resolved addresses and host names that must never be fetched.
 *
 * <p>IPv4-mapped ({@code ::ffff:a.b.c.d}), IPv4-compatible ({@code ::a.b.c.d}) and NAT64
 * ({@code 64:ff9b::a.b.c.d}) IPv6 forms are unwrapped and judged as the embedded IPv4 address.</p>
 */
final class AddressPolicy {

    private static final Set<String> METADATA_HOSTS = Set.of(
            "metadata.google.internal",
            "metadata.goog",
            "metadata",
            "metadata.azure.com",
            "instance-data",
            "instance-data.ec2.internal");

    private static final byte[][] METADATA_V4 = {
            {(byte) 169, (byte) 254, (byte) 169, (byte) 254}, // AWS, GCP, Azure, OpenStack
            {100, 100, 100, (byte) 200}                        // Alibaba Cloud
    };

    // fd00:ec2::254, AWS IMDS over IPv6
    private static final byte[] METADATA_V6 = {
            (byte) 0xfd, 0x00, 0x0e, (byte) 0xc2, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0x02, 0x54
    };

    private AddressPolicy() {
        // utility
    }

    /**
     * Deny reason for a host name that is refused before any DNS lookup.
     */
    static Optional<DenyReason> classifyHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        while (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        if (METADATA_HOSTS.contains(h)) {
            return Optional.of(DenyReason.CLOUD_METADATA);
        }
        if (h.equals("localhost") || h.endsWith(".localhost")) {
            return Optional.of(DenyReason.PRIVATE_IP);
        }
        return Optional.empty();
    }

    /**
     * Deny reason for a resolved address, empty when the address is public.
     */
    static Optional<DenyReason> classify(InetAddress address) {
        byte[] raw = address.getAddress();
        if (address instanceof Inet6Address || raw.length == 16) {
            return classifyV6(raw);
        }
        if (address instanceof Inet4Address || raw.length == 4) {
            return classifyV4(raw);
        }
        return Optional.of(DenyReason.INVALID_URL);
    }

    private static Optional<DenyReason> classifyV4(byte[] a) {
        for (byte[] m : METADATA_V4) {
            if (Arrays.equals(m, a)) return Optional.of(DenyReason.CLOUD_METADATA);
        }
        int b0 = a[0] & 0xFF;
        int b1 = a[1] & 0xFF;
        boolean blocked =
                b0 == 0                                   // 0.0.0.0/8
                || b0 == 10                               // 10.0.0.0/8
                || b0 == 127                              // loopback
                || (b0 == 100 && (b1 & 0xC0) == 64)       // 100.64.0.0/10 carrier-grade NAT
                || (b0 == 169 && b1 == 254)               // link-local
                || (b0 == 172 && (b1 & 0xF0) == 16)       // 172.16.0.0/12
                || (b0 == 192 && b1 == 168)               // 192.168.0.0/16
                || (b0 == 192 && b1 == 0 && (a[2] & 0xFF) == 0) // 192.0.0.0/24
                || (b0 == 198 && (b1 & 0xFE) == 18)       // 198.18.0.0/15 benchmarking
                || b0 >= 224;                             // multicast, reserved, broadcast
        return blocked ? Optional.of(DenyReason.PRIVATE_IP) : Optional.empty();
    }

    private static Optional<DenyReason> classifyV6(byte[] a) {
        if (Arrays.equals(METADATA_V6, a)) {
            return Optional.of(DenyReason.CLOUD_METADATA);
        }
        byte[] embedded = embeddedV4(a);
        if (embedded != null) {
            return classifyV4(embedded);
        }
        if (isAllZero(a, 0, 15) && (a[15] == 0 || a[15] == 1)) {
            return Optional.of(DenyReason.PRIVATE_IP); // :: and ::1
        }
        int b0 = a[0] & 0xFF;
        int b1 = a[1] & 0xFF;
        boolean blocked =
                (b0 & 0xFE) == 0xFC                       // fc00::/7 unique local
                || (b0 == 0xFE && (b1 & 0xC0) == 0x80)    // fe80::/10 link-local
                || (b0 == 0xFE && (b1 & 0xC0) == 0xC0)    // fec0::/10 deprecated site-local
                || b0 == 0xFF;                            // multicast
        return blocked ? Optional.of(DenyReason.PRIVATE_IP) : Optional.empty();
    }

    /**
     * IPv4 address carried inside an IPv6 address, or null when there is none.
     */
    static byte[] embeddedV4(byte[] a) {
        if (a.length != 16) return null;
        boolean mapped = isAllZero(a, 0, 10) && (a[10] & 0xFF) == 0xFF && (a[11] & 0xFF) == 0xFF;
        boolean compatible = isAllZero(a, 0, 12) && !(isAllZero(a, 12, 15) && ((a[15] & 0xFF) <= 1));
        boolean nat64 = (a[0] & 0xFF) == 0x00 && (a[1] & 0xFF) == 0x64 && (a[2] & 0xFF) == 0xFF
                && (a[3] & 0xFF) == 0x9B && isAllZero(a, 4, 12);
        if (mapped || compatible || nat64) {
            return Arrays.copyOfRange(a, 12, 16);
        }
        return null;
    }

    private static boolean isAllZero(byte[] a, int from, int to) {
        for (int i = from; i < to; i++) {
            if (a[i] != 0) return false;
        }
        return true;
    }
}
