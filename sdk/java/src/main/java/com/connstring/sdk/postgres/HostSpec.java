package com.connstring.sdk.postgres;

import com.connstring.sdk.types.HostPort;

/**
 * The {@code hostspec} part of a PostgreSQL connection URI.
 * Either a host using the default port or a host with an explicit port.
 */
abstract class HostSpec {

    private HostSpec() {
    }

    static HostSpec host(String host) {
        return new Host(host);
    }

    static HostSpec hostAndPort(HostPort hostPort) {
        return new HostAndPort(hostPort);
    }

    abstract String render();

    static final class Host extends HostSpec {
        private final String host;

        private Host(String host) {
            this.host = host;
        }

        @Override
        String render() {
            return host;
        }
    }

    static final class HostAndPort extends HostSpec {
        private final HostPort hostPort;

        private HostAndPort(HostPort hostPort) {
            this.hostPort = hostPort;
        }

        @Override
        String render() {
            return hostPort.getHost() + ":" + hostPort.getPort();
        }
    }
}
