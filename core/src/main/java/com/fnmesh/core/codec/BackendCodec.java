package com.fnmesh.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fnmesh.core.model.Backend;
import com.fnmesh.core.util.JsonUtils;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Encoding of the backend list stored at {@code /function/{id}/backends}.
 * <p>
 * <b>Format:</b> UTF-8 JSON array of {@code {"ip": "10.0.0.7", "containerId": "<uuid>"}}
 * objects. A zero-length payload is a valid encoding of the empty list, which is what a
 * freshly created backends node holds before any instance has started.
 * </p>
 */
public final class BackendCodec {
    private static final TypeReference<List<Backend>> BACKEND_LIST = new TypeReference<>() {
    };

    private BackendCodec() {
    }

    /**
     * Encodes a backend list.
     *
     * @param backends Backends to store
     * @return JSON bytes
     */
    public static byte[] encode(Collection<Backend> backends) {
        try {
            return JsonUtils.mapper().writeValueAsBytes(List.copyOf(backends));
        } catch (JsonProcessingException e) {
            throw new BackendCodecException("Failed to encode backends", e);
        }
    }

    /**
     * Decodes a backends payload.
     *
     * @param payload Raw node data; {@code null} and empty mean "no backends"
     * @return Immutable backend list in payload order
     * @throws BackendCodecException if the payload is not a valid backend list
     */
    public static List<Backend> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return List.of();
        }

        List<Backend> backends;
        try {
            backends = JsonUtils.mapper().readValue(payload, BACKEND_LIST);
        } catch (IOException e) {
            throw new BackendCodecException("Malformed backends payload", e);
        }

        if (backends == null) {
            return List.of();
        }
        if (backends.contains(null)) {
            throw new BackendCodecException("Backends payload contains a null entry");
        }
        return List.copyOf(backends);
    }
}
