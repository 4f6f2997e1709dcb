package com.tethersystems.live.commander;

import com.tethersystems.live.LiveSocket;

import java.util.Map;

/**
 * Runs before a handler. Returning false from any applicable hook cancels the handler
 * and its after-hooks.
 */
@FunctionalInterface
public interface BeforeHook {

    boolean before(LiveSocket socket, Map<String, Object> payload) throws Exception;
}
