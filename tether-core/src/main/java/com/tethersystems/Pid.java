package com.tethersystems;

import java.util.concurrent.TimeUnit;

/**
 * Process ID of an actor: the address used to send it messages.
 */
public record Pid(String actorId, ActorSystem system) {

    /**
     * Sends a message to the actor.
     *
     * @param message The message to send
     * @param <Message> The type of the message
     */
    public <Message> void tell(Message message) {
        system.routeMessage(actorId, message);
    }

    /**
     * Sends a message to the actor after a delay.
     *
     * @param message The message to send
     * @param delay The delay amount
     * @param timeUnit The time unit for the delay
     * @param <Message> The type of the message
     */
    public <Message> void tell(Message message, long delay, TimeUnit timeUnit) {
        system.routeMessage(actorId, message, delay, timeUnit);
    }

    @Override
    public String toString() {
        return actorId + "@local";
    }
}
