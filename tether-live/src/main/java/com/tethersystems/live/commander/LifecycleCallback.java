package com.tethersystems.live.commander;

import com.tethersystems.live.LiveSocket;

/**
 * On-connect or on-load callback.
 */
@FunctionalInterface
public interface LifecycleCallback {

    void on(LiveSocket socket) throws Exception;
}
