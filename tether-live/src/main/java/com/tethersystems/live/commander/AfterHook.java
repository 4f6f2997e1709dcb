package com.tethersystems.live.commander;

import com.tethersystems.live.LiveSocket;

import java.util.Map;

/**
 * Runs after a handler, receiving what the handler returned.
 */
@FunctionalInterface
public interface AfterHook {

    void after(LiveSocket socket, Map<String, Object> payload, Object result) throws Exception;
}
