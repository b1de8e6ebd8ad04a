package com.pnode.pnode_analytics.network.discovery;

/**
 * Host and optional port split out of a gossiped {@code host[:port]} address.
 */
public final class HostPort {

    private final String host;
    private final Integer port;

    private HostPort(String host, Integer port) {
        this.host = host;
        this.port = port;
    }

    public static HostPort parse(String address) {
        if (address == null || address.isEmpty()) {
            return new HostPort(null, null);
        }
        if (address.startsWith("[")) {
            return parseBracketed(address);
        }
        int colon = address.lastIndexOf(':');
        // No colon, or more than one (a bare IPv6 literal): no port to split off
        if (colon <= 0 || address.indexOf(':') != colon) {
            return new HostPort(address, null);
        }
        return new HostPort(address.substring(0, colon), parsePort(address.substring(colon + 1)));
    }

    // [v6-literal] or [v6-literal]:port
    private static HostPort parseBracketed(String address) {
        int close = address.indexOf(']');
        if (close < 0) {
            return new HostPort(address.substring(1), null);
        }
        String host = address.substring(1, close);
        String rest = address.substring(close + 1);
        Integer port = rest.startsWith(":") ? parsePort(rest.substring(1)) : null;
        return new HostPort(host.isEmpty() ? null : host, port);
    }

    private static Integer parsePort(String value) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed > 0 && parsed <= 65535 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String host() {
        return host;
    }

    public Integer port() {
        return port;
    }
}
