package com.tethersystems.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Message queue owned by a single actor.
 * Any number of threads may offer messages; exactly one thread (the actor's mailbox loop) consumes them,
 * so message order per sender is preserved and actor state needs no extra locking.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the message if capacity allows.
     *
     * @param message the message to add, never null
     * @return true if the message was added, false if the mailbox is full
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Moves up to maxElements queued messages into the given collection.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    int size();

    boolean isEmpty();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();

    /**
     * Returns the total capacity of this mailbox, or Integer.MAX_VALUE if unbounded.
     *
     * @return the total capacity
     */
    int capacity();
}
