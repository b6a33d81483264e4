package com.agentvet.validation.reference;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Syntactic host checks. Only IP literals are converted to addresses, so
 * no name resolution ever happens.
 */
final class HostClassifier {

    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-fA-F:.]+$");

    private HostClassifier() {}

    static boolean isLocalhostName(String host) {
        String h = stripBrackets(host).toLowerCase(Locale.ROOT);
        return h.equals("localhost") || h.endsWith(".localhost")
                || h.equals("localhost.localdomain") || h.equals("ip6-localhost") || h.equals("ip6-loopback");
    }

    /**
     * True for loopback, private (RFC 1918 / IPv6 ULA), link-local and
     * unspecified IP literals.
     */
    static boolean isPrivateAddress(String host) {
        InetAddress address = parseLiteral(host);
        if (address == null) return false;
        if (address.isLoopbackAddress() || address.isSiteLocalAddress()
                || address.isLinkLocalAddress() || address.isAnyLocalAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        // fc00::/7 unique local
        return bytes.length == 16 && (bytes[0] & 0xfe) == 0xfc;
    }

    static boolean hasSuspiciousTld(String host, List<String> suspiciousTlds) {
        String h = stripBrackets(host).toLowerCase(Locale.ROOT);
        while (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        for (String tld : suspiciousTlds) {
            String suffix = tld.startsWith(".") ? tld : "." + tld;
            if (h.endsWith(suffix.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    private static InetAddress parseLiteral(String host) {
        String h = stripBrackets(host);
        int zone = h.indexOf('%');
        if (zone >= 0) {
            h = h.substring(0, zone);
        }
        boolean ipv4 = IPV4_LITERAL.matcher(h).matches();
        boolean ipv6 = h.indexOf(':') >= 0 && IPV6_LITERAL.matcher(h).matches();
        if (!ipv4 && !ipv6) return null;
        if (ipv4) {
            for (String octet : h.split("\\.")) {
                if (Integer.parseInt(octet) > 255) return null;
            }
        }
        try {
            // brackets force literal parsing for IPv6, never a lookup
            return InetAddress.getByName(ipv6 ? "[" + h + "]" : h);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }
}
