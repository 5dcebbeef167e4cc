package com.fnmesh.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.net.InetAddresses;
import lombok.Value;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable descriptor of one running instance of a function.
 * <p>
 * Identity is the pair (IPv4 address, container id). A backend with a different
 * container id is a different backend even when it is hosted at the same address.
 * </p>
 */
@Value
public class Backend implements Comparable<Backend> {
    private static final Comparator<Backend> ORDER = Comparator
        .comparing(Backend::getIp)
        .thenComparing(Backend::getContainerId);

    /**
     * IPv4 address of the host running the instance, in dotted-quad form.
     */
    @JsonProperty("ip")
    String ip;

    /**
     * Identifier of the running container. Backends expect it as the first
     * path segment after {@code /invoke/}.
     */
    @JsonProperty("containerId")
    UUID containerId;

    @JsonCreator
    public Backend(
        @JsonProperty("ip") String ip,
        @JsonProperty("containerId") UUID containerId
    ) {
        this.ip = requireIpv4(ip);
        this.containerId = Objects.requireNonNull(containerId, "containerId");
    }

    public static Backend of(String ip, UUID containerId) {
        return new Backend(ip, containerId);
    }

    /**
     * Stable identity string used to derive this backend's virtual node positions.
     *
     * @return {@code ip/containerId}
     */
    public String ringKey() {
        return ip + "/" + containerId;
    }

    @Override
    public int compareTo(Backend other) {
        return ORDER.compare(this, other);
    }

    private static String requireIpv4(String ip) {
        Objects.requireNonNull(ip, "ip");
        if (!InetAddresses.isInetAddress(ip)) {
            throw new IllegalArgumentException("Not an IP address: " + ip);
        }
        InetAddress address = InetAddresses.forString(ip);
        if (!(address instanceof Inet4Address)) {
            throw new IllegalArgumentException("Backend address must be IPv4: " + ip);
        }
        return InetAddresses.toAddrString(address);
    }
}
