package com.fnmesh.core.codec;

/**
 * Raised when a backends payload cannot be decoded or a backend list cannot be encoded.
 */
public class BackendCodecException extends RuntimeException {

    public BackendCodecException(String message) {
        super(message);
    }

    public BackendCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
