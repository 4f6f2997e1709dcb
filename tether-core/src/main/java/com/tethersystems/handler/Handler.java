package com.tethersystems.handler;

import com.tethersystems.ActorContext;

/**
 * Message handling logic for a stateless actor, kept separate from the actor machinery.
 *
 * @param <Message> The type of messages this handler processes
 */
public interface Handler<Message> {

    /**
     * Processes a message.
     *
     * @param message The message to process
     * @param context Access to the actor's address, sender and system
     */
    void receive(Message message, ActorContext context);

    default void preStart(ActorContext context) {
    }

    default void postStop(ActorContext context) {
    }

    /**
     * Called when {@link #receive} throws, before the actor's supervision strategy applies.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     * @param context   The actor context
     */
    default void onError(Message message, Throwable exception, ActorContext context) {
    }
}
