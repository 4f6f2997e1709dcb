package com.tethersystems.task;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Handle to a task spawned in a {@link LinkedTaskGroup}.
 *
 * @param <T> The task's result type
 */
public interface TaskHandle<T> {

    String id();

    String name();

    /**
     * Interrupts the task. The owner receives a {@link TaskExit.Reason#KILLED} exit immediately,
     * whether or not the task's code reacts to the interrupt.
     *
     * @return true if this call killed the task, false if it had already exited
     */
    boolean kill();

    boolean isDone();

    /**
     * Waits for the task to finish.
     *
     * @return the task's result
     * @throws TaskFailedException if the task failed or was killed
     */
    T await();

    /**
     * Waits for the task to finish, up to a timeout.
     *
     * @param timeout The longest time to wait
     * @return the task's result
     * @throws TimeoutException if the task is still running after the timeout
     * @throws TaskFailedException if the task failed or was killed
     */
    T await(Duration timeout) throws TimeoutException;

    CompletableFuture<T> future();
}
