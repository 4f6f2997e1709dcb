package com.tethersystems.live;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handle to the live session with one browser page.
 * <p>
 * Sockets are immutable: {@link #assign(String, Object)} and the other {@code with} methods
 * return a new socket, so a transformed socket handed to one dispatch never leaks into another.
 */
public interface LiveSocket {

    String id();

    /**
     * Topic used for broadcasts, shared by all pages of the same view.
     *
     * @return the topic
     */
    String topic();

    Map<String, Object> assigns();

    default Object assign(String key) {
        return assigns().get(key);
    }

    LiveSocket assign(String key, Object value);

    Set<String> capabilities();

    default boolean hasCapability(String name) {
        return capabilities().contains(name);
    }

    LiveSocket withCapability(String name);

    /**
     * Reference to the connection actor serving this socket, set when the socket joins.
     *
     * @return the connection, if joined
     */
    Optional<ConnectionRef> connection();

    LiveSocket withConnection(ConnectionRef connection);

    void push(String event, Map<String, Object> payload);

    void broadcast(String event, Map<String, Object> payload);
}
