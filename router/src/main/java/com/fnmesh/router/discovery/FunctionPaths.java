package com.fnmesh.router.discovery;

import java.util.UUID;

/**
 * ZooKeeper layout below the environment root:
 * <pre>
 * /function
 *   /{functionId}
 *     /backends   ← encoded backend list
 * </pre>
 */
public final class FunctionPaths {
    private FunctionPaths() {
    }

    public static final String FUNCTION_ROOT = "/function";

    public static final String BACKENDS_SUFFIX = "/backends";

    public static String backendsPath(UUID functionId) {
        return FUNCTION_ROOT + "/" + functionId + BACKENDS_SUFFIX;
    }

    public static boolean isBackendsPath(String path) {
        return path != null && path.endsWith(BACKENDS_SUFFIX);
    }

    /**
     * Extracts the function id from the second segment of a node path.
     *
     * @param path e.g. {@code /function/7d3c.../backends}
     * @return parsed function id
     * @throws DiscoveryException if the segment is missing or is not a UUID
     */
    public static UUID functionIdOf(String path) {
        String[] segments = path.split("/");
        if (segments.length < 3) {
            throw new DiscoveryException("Invalid function znode path: " + path);
        }
        return parseFunctionId(segments[2]);
    }

    /**
     * Parses a function node name. Only the canonical 36-character form is accepted.
     *
     * @throws DiscoveryException if the name is not a UUID
     */
    public static UUID parseFunctionId(String name) {
        try {
            UUID id = UUID.fromString(name);
            if (!id.toString().equalsIgnoreCase(name)) {
                throw new DiscoveryException("Invalid function id: " + name);
            }
            return id;
        } catch (IllegalArgumentException e) {
            throw new DiscoveryException("Invalid function id: " + name, e);
        }
    }
}
