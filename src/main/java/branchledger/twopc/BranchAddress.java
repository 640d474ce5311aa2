package branchledger.twopc;

import java.util.Objects;

/**
 * host:port of a branch listener. The host ends up inside pipe-delimited coordinator records,
 * so separators, whitespace and control characters are refused here.
 */
public final class BranchAddress {
    private final String host;
    private final int port;

    public BranchAddress(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        String h = host.trim();
        for (int i = 0; i < h.length(); i++) {
            char c = h.charAt(i);
            if (c == '|' || Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new IllegalArgumentException("illegal character in host: " + host);
            }
        }
        this.host = h;
        this.port = port;
    }

    public static BranchAddress parse(String hostPort) {
        int idx = hostPort == null ? -1 : hostPort.lastIndexOf(':');
        if (idx <= 0) {
            throw new IllegalArgumentException("expected host:port, got " + hostPort);
        }
        int port;
        try {
            port = Integer.parseInt(hostPort.substring(idx + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad port in " + hostPort, e);
        }
        return new BranchAddress(hostPort.substring(0, idx), port);
    }

    public String getHost() { return host; }
    public int getPort() { return port; }

    /** Same port and the same host, treating the usual loopback spellings as one. */
    public boolean isSameEndpoint(BranchAddress other) {
        if (other == null || other.port != port) {
            return false;
        }
        return normalize(host).equals(normalize(other.host));
    }

    private static String normalize(String h) {
        String lower = h.toLowerCase();
        if (lower.equals("localhost") || lower.equals("::1") || lower.equals("0.0.0.0") || lower.startsWith("127.")) {
            return "loopback";
        }
        return lower;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchAddress)) return false;
        BranchAddress that = (BranchAddress) o;
        return port == that.port && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
