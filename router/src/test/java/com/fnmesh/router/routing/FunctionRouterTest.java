package com.fnmesh.router.routing;

import com.fnmesh.core.hash.BackendRing;
import com.fnmesh.core.model.Backend;
import com.fnmesh.router.directory.BackendDirectory;
import com.google.common.net.InetAddresses;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FunctionRouterTest {

    private BackendDirectory directory;
    private FunctionRouter router;

    @BeforeEach
    void setUp() {
        directory = new BackendDirectory(new SimpleMeterRegistry());
        router = new FunctionRouter(directory);
    }

    @Test
    @DisplayName("Unknown function is NOT_FOUND")
    void unknownFunction() {
        UUID functionId = UUID.randomUUID();

        RoutingException ex = assertThrows(RoutingException.class,
            () -> router.pickBackend(functionId, InetAddresses.forString("10.0.0.1")));

        assertEquals(RoutingFailure.NOT_FOUND, ex.getFailure());
        assertEquals(404, ex.getFailure().status().code());
    }

    @Test
    @DisplayName("Known function without backends is UNAVAILABLE")
    void emptyRing() {
        UUID functionId = UUID.randomUUID();
        directory.put(functionId, BackendRing.fromBackends(List.of()));

        RoutingException ex = assertThrows(RoutingException.class,
            () -> router.pickBackend(functionId, InetAddresses.forString("10.0.0.1")));

        assertEquals(RoutingFailure.UNAVAILABLE, ex.getFailure());
        assertEquals(503, ex.getFailure().status().code());
    }

    @Test
    @DisplayName("Same client address always lands on the same backend")
    void clientAffinity() {
        UUID functionId = UUID.randomUUID();
        directory.put(functionId, BackendRing.fromBackends(threeBackends()));
        InetAddress client = InetAddresses.forString("192.168.1.17");

        Backend first = router.pickBackend(functionId, client);
        for (int i = 0; i < 20; i++) {
            assertEquals(first, router.pickBackend(functionId, client));
        }
    }

    @Test
    @DisplayName("Different client addresses spread over several backends")
    void clientsSpread() {
        UUID functionId = UUID.randomUUID();
        directory.put(functionId, BackendRing.fromBackends(threeBackends()));

        Set<Backend> picked = new HashSet<>();
        for (int i = 1; i <= 200; i++) {
            picked.add(router.pickBackend(functionId, InetAddresses.forString("172.16." + (i / 250) + "." + (i % 250))));
        }

        assertTrue(picked.size() >= 2, "expected more than one backend, got " + picked);
    }

    @Test
    @DisplayName("Affinity key is the canonical textual address")
    void affinityKeyIsCanonicalText() {
        assertArrayEquals("10.0.0.1".getBytes(StandardCharsets.UTF_8), FunctionRouter.affinityKey(InetAddresses.forString("10.0.0.1")));
        assertArrayEquals("2001:db8::1".getBytes(StandardCharsets.UTF_8),
            FunctionRouter.affinityKey(InetAddresses.forString("2001:0db8:0000:0000:0000:0000:0000:0001")));
    }

    @Test
    @DisplayName("Routing matches the ring successor of the address text")
    void routingMatchesRing() {
        UUID functionId = UUID.randomUUID();
        BackendRing ring = BackendRing.fromBackends(threeBackends());
        directory.put(functionId, ring);

        Backend expected = ring.successor("10.9.8.7").orElseThrow();

        assertEquals(expected, router.pickBackend(functionId, InetAddresses.forString("10.9.8.7")));
    }

    private static List<Backend> threeBackends() {
        return List.of(
            Backend.of("10.0.0.1", UUID.fromString("00000000-0000-0000-0000-000000000001")),
            Backend.of("10.0.0.2", UUID.fromString("00000000-0000-0000-0000-000000000002")),
            Backend.of("10.0.0.3", UUID.fromString("00000000-0000-0000-0000-000000000003")));
    }
}
