package com.fnmesh.router.discovery;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FunctionPathsTest {

    private static final UUID ID = UUID.fromString("7d3c1f0e-2b4a-4c5d-9e6f-0a1b2c3d4e5f");

    @Test
    void backendsPathLayout() {
        assertEquals("/function/7d3c1f0e-2b4a-4c5d-9e6f-0a1b2c3d4e5f/backends", FunctionPaths.backendsPath(ID));
    }

    @Test
    void recognizesBackendsPaths() {
        assertTrue(FunctionPaths.isBackendsPath(FunctionPaths.backendsPath(ID)));
        assertFalse(FunctionPaths.isBackendsPath("/function/" + ID));
        assertFalse(FunctionPaths.isBackendsPath("/function"));
        assertFalse(FunctionPaths.isBackendsPath(null));
    }

    @Test
    void functionIdFromSecondSegment() {
        assertEquals(ID, FunctionPaths.functionIdOf(FunctionPaths.backendsPath(ID)));
        assertEquals(ID, FunctionPaths.functionIdOf("/function/" + ID));
    }

    @Test
    void rejectsPathWithoutFunctionSegment() {
        assertThrows(DiscoveryException.class, () -> FunctionPaths.functionIdOf("/function"));
    }

    @Test
    void rejectsNonUuidNames() {
        assertThrows(DiscoveryException.class, () -> FunctionPaths.parseFunctionId("not-a-uuid"));
        assertThrows(DiscoveryException.class, () -> FunctionPaths.functionIdOf("/function/abc/backends"));
    }

    @Test
    void rejectsNonCanonicalUuid() {
        // UUID.fromString accepts short groups
        assertThrows(DiscoveryException.class, () -> FunctionPaths.parseFunctionId("1-2-3-4-5"));
    }

    @Test
    void acceptsUppercaseUuid() {
        assertEquals(ID, FunctionPaths.parseFunctionId(ID.toString().toUpperCase()));
    }
}
