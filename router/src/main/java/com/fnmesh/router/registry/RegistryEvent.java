package com.fnmesh.router.registry;

/**
 * One notification from a persistent recursive watch.
 * <p>
 * Session notifications carry {@link Type#SESSION} and the new {@link SessionState};
 * node notifications carry the node path relative to the environment root.
 * </p>
 */
public record RegistryEvent(Type type, String path, SessionState sessionState) {

    public enum Type {
        NODE_CREATED,
        NODE_DELETED,
        NODE_DATA_CHANGED,
        SESSION,
        OTHER
    }

    public enum SessionState {
        CONNECTED,
        DISCONNECTED,
        EXPIRED,
        CLOSED,
        OTHER;

        /**
         * @return true if the session that delivered this state can no longer be trusted
         */
        public boolean isTerminal() {
            return this == DISCONNECTED || this == EXPIRED || this == CLOSED;
        }
    }

    public static RegistryEvent node(Type type, String path) {
        return new RegistryEvent(type, path, SessionState.CONNECTED);
    }

    public static RegistryEvent session(SessionState state) {
        return new RegistryEvent(Type.SESSION, "", state);
    }

    public boolean isSessionTerminal() {
        return type == Type.SESSION && sessionState.isTerminal();
    }
}
