package com.tethersystems.live;

import com.tethersystems.live.capability.CoreCapability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State owned by a connection actor. Every field is replaced wholesale; nothing is merged.
 *
 * @param store       Values that survive reconnects of the same logical session
 * @param session     Copy of the web session taken at connect time
 * @param socket      The current socket, null before the first connect
 * @param privateData Actor-internal scratch, never handed to handlers
 */
public record ConnectionState(Map<String, Object> store,
                              Map<String, Object> session,
                              LiveSocket socket,
                              Map<String, Object> privateData) {

    public enum Field {
        STORE, SESSION, SOCKET, PRIVATE
    }

    public ConnectionState {
        store = freeze(store);
        session = freeze(session);
        privateData = freeze(privateData);
    }

    public static ConnectionState empty() {
        return new ConnectionState(Map.of(), Map.of(), null, Map.of());
    }

    /**
     * State after a (re)connect of the given, already transformed, socket. The store is taken
     * from the socket only when it carries one; session and socket are always replaced.
     *
     * @param connected The socket after connection transforms
     * @return the new state
     */
    public ConnectionState connect(LiveSocket connected) {
        Map<String, Object> carriedStore = asMap(connected.assign(CoreCapability.STORE_ASSIGN));
        Map<String, Object> carriedSession = asMap(connected.assign(CoreCapability.SESSION_ASSIGN));
        return new ConnectionState(
                carriedStore != null ? carriedStore : store,
                carriedSession != null ? carriedSession : Map.of(),
                connected,
                privateData);
    }

    public Object get(Field field) {
        switch (field) {
            case STORE:
                return store;
            case SESSION:
                return session;
            case SOCKET:
                return socket;
            case PRIVATE:
                return privateData;
            default:
                throw new IllegalArgumentException("Unknown field: " + field);
        }
    }

    @SuppressWarnings("unchecked")
    public ConnectionState with(Field field, Object value) {
        Objects.requireNonNull(field, "field");
        switch (field) {
            case STORE:
                return new ConnectionState((Map<String, Object>) value, session, socket, privateData);
            case SESSION:
                return new ConnectionState(store, (Map<String, Object>) value, socket, privateData);
            case SOCKET:
                return new ConnectionState(store, session, (LiveSocket) value, privateData);
            case PRIVATE:
                return new ConnectionState(store, session, socket, (Map<String, Object>) value);
            default:
                throw new IllegalArgumentException("Unknown field: " + field);
        }
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
