package com.fnmesh.router.http;

import com.fnmesh.core.model.Backend;
import com.fnmesh.router.routing.RoutingException;
import com.fnmesh.router.routing.RoutingFailure;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InvokePathTest {

    private static final UUID FUNCTION = UUID.fromString("7d3c1f0e-2b4a-4c5d-9e6f-0a1b2c3d4e5f");
    private static final Backend BACKEND = Backend.of("10.0.0.7", UUID.fromString("11111111-2222-3333-4444-555555555555"));

    @Test
    void bareFunctionPathHasEmptySuffix() {
        InvokePath path = InvokePath.parse("/invoke/" + FUNCTION);

        assertEquals(FUNCTION, path.functionId());
        assertEquals("", path.suffix());
        assertNull(path.query());
        assertEquals("http://10.0.0.7:8001/invoke/11111111-2222-3333-4444-555555555555/", path.targetUri(BACKEND, 8001));
    }

    @Test
    void trailingSlashHasEmptySuffix() {
        InvokePath path = InvokePath.parse("/invoke/" + FUNCTION + "/");

        assertEquals("", path.suffix());
        assertEquals("http://10.0.0.7:8001/invoke/11111111-2222-3333-4444-555555555555/", path.targetUri(BACKEND, 8001));
    }

    @Test
    void suffixIsEverythingAfterTheId() {
        InvokePath path = InvokePath.parse("/invoke/" + FUNCTION + "/a/b/c.json");

        assertEquals("a/b/c.json", path.suffix());
        assertEquals("http://10.0.0.7:9000/invoke/11111111-2222-3333-4444-555555555555/a/b/c.json",
            path.targetUri(BACKEND, 9000));
    }

    @Test
    void queryIsCarriedToTheBackend() {
        InvokePath path = InvokePath.parse("/invoke/" + FUNCTION + "/run?x=1&y=two");

        assertEquals("run", path.suffix());
        assertEquals("x=1&y=two", path.query());
        assertEquals("http://10.0.0.7:8001/invoke/11111111-2222-3333-4444-555555555555/run?x=1&y=two",
            path.targetUri(BACKEND, 8001));
    }

    @Test
    void invalidFunctionIdIsBadRequest() {
        RoutingException ex = assertThrows(RoutingException.class, () -> InvokePath.parse("/invoke/not-a-uuid/x"));
        assertEquals(RoutingFailure.BAD_REQUEST, ex.getFailure());
    }

    @Test
    void emptyFunctionIdIsBadRequest() {
        RoutingException ex = assertThrows(RoutingException.class, () -> InvokePath.parse("/invoke/"));
        assertEquals(RoutingFailure.BAD_REQUEST, ex.getFailure());
    }

    @Test
    void nonCanonicalFunctionIdIsBadRequest() {
        RoutingException ex = assertThrows(RoutingException.class, () -> InvokePath.parse("/invoke/1-2-3-4-5"));
        assertEquals(RoutingFailure.BAD_REQUEST, ex.getFailure());
    }
}
