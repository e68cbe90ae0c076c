package com.questrail.debuglink.discovery;

import java.net.URI;
import java.util.Objects;

/**
 * RemoteDiscoveryStrategy
 * -----------------------------------------------------------------------------
 * A remote emulator serves the debugger from its own host, so the only peer is
 * that host. The entry is derived from the origin the front-end was loaded
 * from: {@code http://host} becomes {@code ws://host/ws} and {@code https://host}
 * becomes {@code wss://host/ws}.
 *
 * <p>The entry is recorded once at start and never expires.</p>
 */
public final class RemoteDiscoveryStrategy implements DiscoveryStrategy
{
    private final URI origin;

    /**
     * @param origin {@code http} or {@code https} origin, e.g. {@code http://localhost:9999}
     */
    public RemoteDiscoveryStrategy(URI origin)
    {
        this.origin = Objects.requireNonNull(origin, "origin");
        if (origin.getHost() == null) {
            throw new IllegalArgumentException("origin has no host: " + origin);
        }
    }

    @Override
    public ConnectionMode mode()
    {
        return ConnectionMode.REMOTE;
    }

    @Override
    public void start(DiscoveryRegistry registry)
    {
        Objects.requireNonNull(registry, "registry");
        registry.record(endpointUrl(), displayName(), ConnectionMode.REMOTE);
    }

    @Override
    public void stop()
    {
        // Nothing to release.
    }

    String endpointUrl()
    {
        String scheme = "https".equalsIgnoreCase(origin.getScheme()) ? "wss" : "ws";
        return scheme + "://" + hostAndPort() + "/ws";
    }

    String displayName()
    {
        return "nullDC @ " + hostAndPort();
    }

    private String hostAndPort()
    {
        return origin.getPort() == -1 ? origin.getHost() : origin.getHost() + ":" + origin.getPort();
    }
}
