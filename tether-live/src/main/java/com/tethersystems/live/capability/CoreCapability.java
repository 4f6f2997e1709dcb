package com.tethersystems.live.capability;

import com.tethersystems.live.ConnectionState;
import com.tethersystems.live.LiveSocket;

import java.util.Map;

/**
 * Always active. Carries the session and store sent with the connect payload into the
 * socket's assigns, where the connection actor picks them up.
 */
public class CoreCapability implements CapabilityModule {

    public static final String NAME = "core";

    public static final String STORE_ASSIGN = "tether_store";
    public static final String SESSION_ASSIGN = "tether_session";

    static final String STORE_KEY = "store";
    static final String SESSION_KEY = "session";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public LiveSocket transformConnection(LiveSocket socket, Map<String, Object> payload, ConnectionState state) {
        LiveSocket result = socket;
        Object session = payload.get(SESSION_KEY);
        if (session instanceof Map) {
            result = result.assign(SESSION_ASSIGN, session);
        }
        Object store = payload.get(STORE_KEY);
        if (store instanceof Map) {
            result = result.assign(STORE_ASSIGN, store);
        }
        return result;
    }
}
