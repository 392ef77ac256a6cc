package com.connstring.sdk.types;

import java.util.Objects;

/**
 * Host and port bundled as one immutable value
 */
public final class HostPort {
    private final String host;
    private final int port;

    public HostPort(String host, int port) {
        if (host == null) {
            throw new IllegalArgumentException("host is required");
        }
        if (port < 0) {
            throw new IllegalArgumentException("port must not be negative: " + port);
        }
        this.host = host;
        this.port = port;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HostPort)) return false;
        HostPort that = (HostPort) o;
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
