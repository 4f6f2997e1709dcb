package com.tethersystems;

import com.tethersystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Encapsulates mailbox polling and message dispatch for an actor.
 * A single thread drains the mailbox, so everything the lifecycle's {@code receive} touches is
 * confined to that thread.
 *
 * @param <T> The type of messages in the mailbox
 */
public class MailboxProcessor<T> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private static final long POLL_TIMEOUT_MS = 100;
    private static final long START_TIMEOUT_SECONDS = 5;

    private final String actorId;
    private final Mailbox<T> mailbox;
    private final int batchSize;
    private final List<T> batchBuffer;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final ActorLifecycle<T> lifecycle;
    private final ThreadFactory threadFactory;
    private final long joinTimeoutMillis;

    private volatile boolean running = false;
    private volatile Thread thread;

    /**
     * Creates a new mailbox processor.
     *
     * @param actorId           The ID of the actor for logging
     * @param mailbox           The mailbox to poll messages from
     * @param batchSize         Number of messages to process per batch
     * @param exceptionHandler  Handler to route message processing errors
     * @param lifecycle         Lifecycle hooks (preStart/receive/postStop)
     * @param threadFactory     Factory for the mailbox thread
     * @param joinTimeoutMillis How long {@link #stop()} waits for the mailbox thread to exit
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<T> mailbox,
            int batchSize,
            BiConsumer<T, Throwable> exceptionHandler,
            ActorLifecycle<T> lifecycle,
            ThreadFactory threadFactory,
            long joinTimeoutMillis) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.batchSize = batchSize;
        this.batchBuffer = new ArrayList<>(batchSize);
        this.exceptionHandler = exceptionHandler;
        this.lifecycle = lifecycle;
        this.threadFactory = threadFactory;
        this.joinTimeoutMillis = joinTimeoutMillis;
    }

    /**
     * Starts mailbox polling. Blocks until the mailbox thread is running, so that a message told
     * right after start is never raced by thread creation.
     */
    public void start() {
        if (running) {
            logger.debug("Actor {} mailbox already running", actorId);
            return;
        }
        running = true;
        logger.debug("Starting actor {} mailbox", actorId);
        lifecycle.preStart();

        CountDownLatch readyLatch = new CountDownLatch(1);
        thread = threadFactory.newThread(() -> {
            readyLatch.countDown();
            processMailboxLoop();
        });
        thread.start();

        try {
            if (!readyLatch.await(START_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Actor {} did not start within timeout", actorId);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for actor {} to start", actorId);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops mailbox polling, discards pending messages and runs {@code postStop} on the calling thread.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        logger.debug("Stopping actor {} mailbox", actorId);
        mailbox.clear();
        Thread mailboxThread = thread;
        // stop() may be called from inside receive(), in which case the loop exits on its own
        if (mailboxThread != null && Thread.currentThread() != mailboxThread) {
            mailboxThread.interrupt();
            try {
                mailboxThread.join(joinTimeoutMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        thread = null;
        lifecycle.postStop();
    }

    /**
     * Delivers a message to the mailbox.
     *
     * @param message The message to enqueue
     * @return true if the message was accepted
     */
    public boolean tell(T message) {
        boolean accepted = mailbox.offer(message);
        if (!accepted) {
            logger.warn("Actor {} mailbox full, dropping message {}", actorId, message);
        }
        return accepted;
    }

    public boolean isRunning() {
        return running;
    }

    public int getCurrentSize() {
        return mailbox.size();
    }

    private void processMailboxLoop() {
        while (running) {
            try {
                batchBuffer.clear();
                T first = mailbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batchBuffer.add(first);
                if (batchSize > 1) {
                    mailbox.drainTo(batchBuffer, batchSize - 1);
                }
                for (T msg : batchBuffer) {
                    if (!running) {
                        break;
                    }
                    try {
                        lifecycle.receive(msg);
                    } catch (Throwable e) {
                        logger.error("Actor {} error processing message: {}", actorId, msg, e);
                        exceptionHandler.accept(msg, e);
                    }
                }
            } catch (InterruptedException e) {
                logger.debug("Actor {} mailbox interrupted", actorId);
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
