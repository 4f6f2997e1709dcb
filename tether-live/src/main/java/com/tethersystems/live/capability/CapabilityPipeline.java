package com.tethersystems.live.capability;

import com.tethersystems.live.ConnectionState;
import com.tethersystems.live.LiveSocket;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, resolved list of capability modules. Transforms are folded left to right, so with
 * modules {@code [A, B]} a handler sees {@code B(A(raw))}.
 */
public final class CapabilityPipeline {

    private final List<CapabilityModule> modules;

    public CapabilityPipeline(List<CapabilityModule> modules) {
        this.modules = List.copyOf(modules);
    }

    public Map<String, Object> transformPayload(Map<String, Object> payload, ConnectionState state) {
        Map<String, Object> current = payload;
        for (CapabilityModule module : modules) {
            current = module.transformPayload(current, state);
        }
        return current;
    }

    /**
     * Runs every module's connection transform and marks the socket with each module's name.
     *
     * @param socket  The socket to adapt
     * @param payload The already transformed payload
     * @param state   Snapshot of the connection state
     * @return the adapted socket
     */
    public LiveSocket transformConnection(LiveSocket socket, Map<String, Object> payload, ConnectionState state) {
        LiveSocket current = socket;
        for (CapabilityModule module : modules) {
            current = module.transformConnection(current, payload, state).withCapability(module.name());
        }
        return current;
    }

    public List<CapabilityModule> modules() {
        return modules;
    }

    public List<String> names() {
        return modules.stream().map(CapabilityModule::name).collect(Collectors.toList());
    }
}
