package com.tethersystems.live.commander;

import com.tethersystems.live.LiveSocket;

import java.util.Map;

/**
 * Handles one kind of UI event.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * @param socket  The connection, after capability transforms
     * @param payload The event payload, after capability transforms
     * @return a value handed to the after-hooks, may be null
     * @throws Exception any failure; it is reported and the page is still acknowledged
     */
    Object handle(LiveSocket socket, Map<String, Object> payload) throws Exception;
}
