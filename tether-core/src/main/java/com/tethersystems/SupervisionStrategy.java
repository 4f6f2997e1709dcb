package com.tethersystems;

/**
 * Supervision strategies for failures raised inside an actor's own mailbox loop.
 * Failures of linked tasks never reach these; they arrive as exit signals instead.
 */
public enum SupervisionStrategy {
    /**
     * Resume processing the next message, ignoring the failure.
     */
    RESUME,

    /**
     * Stop the actor.
     */
    STOP,

    /**
     * Stop the actor and raise the failure to the caller of the mailbox loop.
     */
    ESCALATE
}
