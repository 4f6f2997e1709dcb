package com.tethersystems.live;

import java.util.Map;

/**
 * One inbound UI event on its way to a handler.
 *
 * @param eventName   The DOM event, e.g. {@code click}
 * @param handlerName The registered handler to run
 * @param payload     The raw payload from the page
 * @param replyToken  Token echoed back in the completion acknowledgment
 */
public record EventInvocation(String eventName, String handlerName, Map<String, Object> payload, Object replyToken) {

    public EventInvocation {
        payload = payload == null ? Map.of() : payload;
    }
}
