package com.ztverify.riskauth.domain.risk;

import java.util.List;

/**
 * IPv4 CIDR block. Parsing is purely textual; no name resolution ever happens here.
 */
public record Ipv4Range(long network, int prefixLength) {

    /** Private, loopback, link-local, documentation and reserved IPv4 blocks. */
    public static final List<Ipv4Range> NON_ROUTABLE = List.of(
            parse("0.0.0.0/8"),
            parse("10.0.0.0/8"),
            parse("127.0.0.0/8"),
            parse("169.254.0.0/16"),
            parse("172.16.0.0/12"),
            parse("192.0.0.0/29"),
            parse("192.0.2.0/24"),
            parse("192.168.0.0/16"),
            parse("198.18.0.0/15"),
            parse("198.51.100.0/24"),
            parse("203.0.113.0/24"),
            parse("240.0.0.0/4"),
            parse("255.255.255.255/32")
    );

    public static Ipv4Range parse(String cidr) {
        String[] parts = cidr.trim().split("/");
        long address = toLong(parts[0]);
        if (address < 0) {
            throw new IllegalArgumentException("Invalid IPv4 CIDR: " + cidr);
        }
        int prefix = parts.length > 1 ? Integer.parseInt(parts[1]) : 32;
        if (prefix < 0 || prefix > 32) {
            throw new IllegalArgumentException("Invalid prefix length in " + cidr);
        }
        return new Ipv4Range(address & mask(prefix), prefix);
    }

    public boolean contains(String ip) {
        long address = toLong(ip);
        return address >= 0 && (address & mask(prefixLength)) == network;
    }

    public static boolean isNonRoutable(String ip) {
        return NON_ROUTABLE.stream().anyMatch(r -> r.contains(ip));
    }

    /** Dotted-quad to unsigned value, or -1 when the text is not an IPv4 literal. */
    static long toLong(String ip) {
        if (ip == null) {
            return -1;
        }
        String[] octets = ip.trim().split("\\.", -1);
        if (octets.length != 4) {
            return -1;
        }
        long value = 0;
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                return -1;
            }
            int part = Integer.parseInt(octet);
            if (part > 255) {
                return -1;
            }
            value = (value << 8) | part;
        }
        return value;
    }

    private static long mask(int prefix) {
        return prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    }
}
