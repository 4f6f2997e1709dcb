package com.tethersystems.live.capability;

import com.tethersystems.live.ConfigurationException;
import com.tethersystems.live.LiveSocket;
import com.tethersystems.live.bridge.PeerReply;
import com.tethersystems.live.bridge.RequestResponseBridge;

import java.time.Duration;
import java.util.Map;

/**
 * Runs JavaScript on connected pages.
 */
public class CoreCommands {

    public static final String EXECJS = "execjs";
    public static final String BROADCASTJS = "broadcastjs";

    private final RequestResponseBridge bridge;

    public CoreCommands(RequestResponseBridge bridge) {
        this.bridge = bridge;
    }

    /**
     * Evaluates JavaScript on the page and waits for its result.
     *
     * @param socket The page
     * @param js     The script
     * @return the value of the script's last expression, the page's error, or a timeout
     */
    public PeerReply execJs(LiveSocket socket, String js) {
        requireCapability(socket, CoreCapability.NAME);
        return bridge.pushAndWait(socket, EXECJS, Map.of("js", js));
    }

    public PeerReply execJs(LiveSocket socket, String js, Duration timeout) {
        requireCapability(socket, CoreCapability.NAME);
        return bridge.pushAndWait(socket, EXECJS, Map.of("js", js), timeout);
    }

    /**
     * Evaluates JavaScript on every page sharing the socket's topic. Does not wait.
     */
    public void broadcastJs(LiveSocket socket, String js) {
        requireCapability(socket, CoreCapability.NAME);
        bridge.broadcast(socket, BROADCASTJS, Map.of("js", js));
    }

    static void requireCapability(LiveSocket socket, String capability) {
        if (!socket.hasCapability(capability)) {
            throw new ConfigurationException(
                    "Capability '" + capability + "' is not active on " + socket.id() + "; add it to the commander binding");
        }
    }
}
