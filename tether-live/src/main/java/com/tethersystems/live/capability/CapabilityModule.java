package com.tethersystems.live.capability;

import com.tethersystems.live.ConnectionState;
import com.tethersystems.live.LiveSocket;

import java.util.List;
import java.util.Map;

/**
 * A pluggable module that preprocesses inbound payloads and adapts the socket before
 * handlers see them.
 */
public interface CapabilityModule {

    /**
     * Name used to request the module in a commander binding and to mark sockets.
     *
     * @return the module name
     */
    String name();

    /**
     * Names of modules that must run before this one.
     *
     * @return prerequisite names, empty by default
     */
    default List<String> prerequisites() {
        return List.of();
    }

    default Map<String, Object> transformPayload(Map<String, Object> payload, ConnectionState state) {
        return payload;
    }

    default LiveSocket transformConnection(LiveSocket socket, Map<String, Object> payload, ConnectionState state) {
        return socket;
    }
}
