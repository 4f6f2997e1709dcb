package com.tethersystems.live;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link LiveSocket} writing to a {@link Transport}.
 */
public final class DefaultLiveSocket implements LiveSocket {

    private final String id;
    private final String topic;
    private final Transport transport;
    private final Map<String, Object> assigns;
    private final Set<String> capabilities;
    private final ConnectionRef connection;

    public DefaultLiveSocket(String id, String topic, Transport transport) {
        this(id, topic, transport, Map.of(), Set.of(), null);
    }

    private DefaultLiveSocket(String id, String topic, Transport transport, Map<String, Object> assigns,
                              Set<String> capabilities, ConnectionRef connection) {
        this.id = Objects.requireNonNull(id, "id");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.assigns = assigns;
        this.capabilities = capabilities;
        this.connection = connection;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public Map<String, Object> assigns() {
        return assigns;
    }

    @Override
    public LiveSocket assign(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(assigns);
        updated.put(key, value);
        return new DefaultLiveSocket(id, topic, transport, Collections.unmodifiableMap(updated), capabilities, connection);
    }

    @Override
    public Set<String> capabilities() {
        return capabilities;
    }

    @Override
    public LiveSocket withCapability(String name) {
        if (capabilities.contains(name)) {
            return this;
        }
        Set<String> updated = new LinkedHashSet<>(capabilities);
        updated.add(name);
        return new DefaultLiveSocket(id, topic, transport, assigns, Collections.unmodifiableSet(updated), connection);
    }

    @Override
    public Optional<ConnectionRef> connection() {
        return Optional.ofNullable(connection);
    }

    @Override
    public LiveSocket withConnection(ConnectionRef connection) {
        return new DefaultLiveSocket(id, topic, transport, assigns, capabilities, connection);
    }

    @Override
    public void push(String event, Map<String, Object> payload) {
        transport.push(id, event, payload);
    }

    @Override
    public void broadcast(String event, Map<String, Object> payload) {
        transport.broadcast(topic, event, payload);
    }

    @Override
    public String toString() {
        return "LiveSocket[" + id + ", topic=" + topic + ", capabilities=" + capabilities + "]";
    }
}
