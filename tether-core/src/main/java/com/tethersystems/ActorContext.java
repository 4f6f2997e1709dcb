package com.tethersystems;

import org.slf4j.Logger;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * What a {@link com.tethersystems.handler.Handler} can see of the actor running it.
 */
public interface ActorContext {

    Pid self();

    String getActorId();

    <T> void tell(Pid target, T message);

    <T> void tellSelf(T message);

    <T> void tellSelf(T message, long delay, TimeUnit timeUnit);

    /**
     * The sender of the current message, present when the message arrived through an ask.
     *
     * @return the sender pid, if any
     */
    Optional<Pid> getSender();

    /**
     * Replies to the sender of the current message, if there is one.
     *
     * @param response The response
     * @param <T> The response type
     */
    default <T> void reply(T response) {
        getSender().ifPresent(sender -> sender.tell(response));
    }

    ActorSystem getSystem();

    void stop();

    Logger getLogger();
}
