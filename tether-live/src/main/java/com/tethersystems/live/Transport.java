package com.tethersystems.live;

import java.util.Map;

/**
 * The wire behind a {@link LiveSocket}, typically a WebSocket channel.
 */
public interface Transport {

    /**
     * Sends an event to one connected page.
     *
     * @param socketId The connection id
     * @param event    The event name, e.g. {@code execjs}
     * @param payload  The event payload
     */
    void push(String socketId, String event, Map<String, Object> payload);

    /**
     * Sends an event to every page subscribed to a topic.
     *
     * @param topic   The topic
     * @param event   The event name
     * @param payload The event payload
     */
    void broadcast(String topic, String event, Map<String, Object> payload);
}
