package com.tethersystems.live.commander;

import java.util.Map;

/**
 * Called when a connection actor stops. The socket is gone by then, so only the
 * store and session are passed.
 */
@FunctionalInterface
public interface DisconnectCallback {

    void onDisconnect(Map<String, Object> store, Map<String, Object> session) throws Exception;
}
