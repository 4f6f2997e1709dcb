package com.tethersystems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an actor's {@link SupervisionStrategy} to a failure raised in its mailbox loop.
 */
public final class Supervisor {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private Supervisor() {
    }

    /**
     * Handles an exception thrown while the actor processed a message.
     *
     * @param actor     The actor that experienced the error
     * @param message   The message being processed when the error occurred
     * @param exception The exception that was thrown
     * @param <T>       The actor's message type
     */
    public static <T> void handleException(Actor<T> actor, T message, Throwable exception) {
        actor.onError(message, exception);
        switch (actor.getSupervisionStrategy()) {
            case RESUME:
                logger.debug("Actor {} resuming after error", actor.getActorId());
                break;
            case STOP:
                logger.info("Stopping actor {} due to error", actor.getActorId());
                actor.stop();
                break;
            case ESCALATE:
                logger.info("Escalating error from actor {}", actor.getActorId());
                actor.stop();
                throw new ActorException("Error in actor", exception, actor.getActorId());
            default:
                throw new IllegalStateException("Unknown supervision strategy: " + actor.getSupervisionStrategy());
        }
    }
}
