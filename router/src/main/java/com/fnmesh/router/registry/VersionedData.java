package com.fnmesh.router.registry;

/**
 * Node payload together with the node's data version at read time.
 */
public record VersionedData(byte[] data, int version) {
}
