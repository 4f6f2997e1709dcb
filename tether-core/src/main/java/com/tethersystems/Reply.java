package com.tethersystems;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Reply to an ask pattern message.
 * Provides three tiers of API:
 * 1. Simple: get() - blocks and returns the value
 * 2. Safe: await() - returns a Result
 * 3. Advanced: future() - the underlying CompletableFuture
 */
public interface Reply<T> {

    /**
     * Blocks until the reply is available and returns the value.
     * Throws unchecked ReplyException if the ask fails.
     */
    T get();

    /**
     * Blocks until the reply is available or the timeout expires.
     *
     * @throws TimeoutException if timeout expires before reply
     * @throws ReplyException if the ask fails
     */
    T get(Duration timeout) throws TimeoutException;

    /**
     * Blocks until the reply is available and returns a Result.
     */
    Result<T> await();

    /**
     * Blocks until the reply is available or the timeout expires.
     * Returns a failed Result holding a TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check; empty while the reply is still pending.
     */
    Optional<Result<T>> poll();

    CompletableFuture<T> future();

    static <T> Reply<T> from(CompletableFuture<T> future) {
        return new PendingReply<>(future);
    }

    static <T> Reply<T> completed(T value) {
        return new PendingReply<>(CompletableFuture.completedFuture(value));
    }

    static <T> Reply<T> failed(Throwable error) {
        return new PendingReply<>(CompletableFuture.failedFuture(error));
    }
}
