package com.tethersystems;

import com.tethersystems.config.MailboxConfig;
import com.tethersystems.config.ThreadPoolFactory;
import com.tethersystems.handler.Handler;
import com.tethersystems.internal.HandlerActor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry and runtime for actors: routes messages, runs the ask pattern, owns the timer
 * and task executors.
 */
public class ActorSystem {

    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);
    private static final String ASK_PREFIX = "ask-promise-";

    /**
     * A message paired with the address to reply to.
     */
    record MessageWithSender<T>(T message, Pid sender) {
    }

    private final ConcurrentHashMap<String, Actor<?>> actors = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Object>> pendingAskPromises = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> delayedMessages = new ConcurrentHashMap<>();
    private final AtomicLong actorCounter = new AtomicLong();
    private final ThreadPoolFactory threadPoolFactory;
    private final MailboxConfig mailboxConfig;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService taskExecutor;
    private volatile boolean shutdown = false;

    public ActorSystem() {
        this(new ThreadPoolFactory(), new MailboxConfig());
    }

    public ActorSystem(ThreadPoolFactory threadPoolFactory) {
        this(threadPoolFactory, new MailboxConfig());
    }

    public ActorSystem(ThreadPoolFactory threadPoolFactory, MailboxConfig mailboxConfig) {
        this.threadPoolFactory = threadPoolFactory;
        this.mailboxConfig = mailboxConfig;
        this.scheduler = threadPoolFactory.createScheduledExecutorService("actor-system");
        this.taskExecutor = threadPoolFactory.createTaskExecutor("actor-system");
    }

    /**
     * Registers and starts an actor instance.
     *
     * @param actor The actor
     * @param <A> The actor type
     * @return the started actor
     * @throws IllegalStateException if an actor with the same id is registered
     */
    public <A extends Actor<?>> A register(A actor) {
        if (shutdown) {
            throw new IllegalStateException("Actor system is shut down");
        }
        if (actors.putIfAbsent(actor.getActorId(), actor) != null) {
            throw new IllegalStateException("Actor already registered: " + actor.getActorId());
        }
        actor.start();
        return actor;
    }

    /**
     * Spawns a handler-based actor with a generated id.
     *
     * @param handler The message handler
     * @param <Message> The message type
     * @return the new actor's pid
     */
    public <Message> Pid spawn(Handler<Message> handler) {
        return spawn(generateActorId(), handler);
    }

    public <Message> Pid spawn(String actorId, Handler<Message> handler) {
        return register(new HandlerActor<>(this, actorId, handler)).self();
    }

    public Optional<Actor<?>> getActor(String actorId) {
        return Optional.ofNullable(actors.get(actorId));
    }

    public Optional<Actor<?>> getActor(Pid pid) {
        return getActor(pid.actorId());
    }

    public Collection<Actor<?>> getActors() {
        return List.copyOf(actors.values());
    }

    /**
     * Stops the actor behind the given pid, if it is registered.
     *
     * @param pid The actor's pid
     */
    public void stopActor(Pid pid) {
        Actor<?> actor = actors.get(pid.actorId());
        if (actor != null) {
            actor.stop();
        }
    }

    // removes only this instance; a successor registered under the same id stays
    void unregister(Actor<?> actor) {
        actors.remove(actor.getActorId(), actor);
    }

    /**
     * Routes a message to an actor, or completes a pending ask when the id is an ask promise.
     *
     * @param actorId The target id
     * @param message The message
     * @param <Message> The message type
     */
    @SuppressWarnings("unchecked")
    public <Message> void routeMessage(String actorId, Message message) {
        if (actorId.startsWith(ASK_PREFIX)) {
            CompletableFuture<Object> promise = pendingAskPromises.remove(actorId);
            if (promise != null) {
                promise.complete(message);
            } else {
                logger.debug("Discarding late reply for {}", actorId);
            }
            return;
        }
        Actor<Message> actor = (Actor<Message>) actors.get(actorId);
        if (actor != null) {
            actor.tell(message);
        } else {
            logger.warn("Message to unknown actor {} dropped: {}", actorId, message);
        }
    }

    public <Message> void routeMessage(String actorId, Message message, long delay, TimeUnit timeUnit) {
        String key = actorId + "-" + UUID.randomUUID();
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            delayedMessages.remove(key);
            routeMessage(actorId, message);
        }, delay, timeUnit);
        delayedMessages.put(key, future);
    }

    public <Message> void tell(Pid pid, Message message) {
        routeMessage(pid.actorId(), message);
    }

    /**
     * Sends a request and returns a reply that completes with whatever the actor sends back to
     * {@code getSender()}, or fails with a {@link TimeoutException} after the timeout.
     *
     * @param target  The actor to ask
     * @param message The request
     * @param timeout How long to wait for the reply
     * @param <Request> The request type
     * @param <Response> The expected response type
     * @return the pending reply
     */
    @SuppressWarnings("unchecked")
    public <Request, Response> Reply<Response> ask(Pid target, Request message, Duration timeout) {
        Actor<?> actor = actors.get(target.actorId());
        if (actor == null) {
            return Reply.failed(new ActorException("Actor not found: " + target.actorId(), null, target.actorId()));
        }
        String promiseId = ASK_PREFIX + UUID.randomUUID();
        CompletableFuture<Object> promise = new CompletableFuture<>();
        pendingAskPromises.put(promiseId, promise);

        ScheduledFuture<?> timeoutTask = scheduler.schedule(() -> {
            CompletableFuture<Object> pending = pendingAskPromises.remove(promiseId);
            if (pending != null) {
                pending.completeExceptionally(new TimeoutException(
                        "Ask to " + target.actorId() + " timed out after " + timeout.toMillis() + " ms"));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        promise.whenComplete((result, error) -> timeoutTask.cancel(false));

        actor.tellWithSender(message, new Pid(promiseId, this));
        return Reply.from(promise.thenApply(result -> (Response) result));
    }

    public String generateActorId() {
        return "actor-" + actorCounter.incrementAndGet();
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    /**
     * Executor for work that runs outside actor mailbox threads.
     *
     * @return the shared task executor
     */
    public ExecutorService getTaskExecutor() {
        return taskExecutor;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stops every actor in parallel, fails outstanding asks, then shuts down the executors.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down actor system with {} actors", actors.size());

        List<Actor<?>> toStop = new ArrayList<>(actors.values());
        ExecutorService stopper = Executors.newCachedThreadPool(threadPoolFactory.createThreadFactory("actor-system-stop"));
        try {
            CompletableFuture<?>[] stops = toStop.stream()
                    .map(actor -> CompletableFuture.runAsync(actor::stop, stopper))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(stops).get(threadPoolFactory.getActorShutdownTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.warn("Not all actors stopped cleanly", e);
        } finally {
            stopper.shutdownNow();
        }
        actors.clear();

        delayedMessages.values().forEach(future -> future.cancel(false));
        delayedMessages.clear();
        pendingAskPromises.values().forEach(promise ->
                promise.completeExceptionally(new ActorException("Actor system shut down")));
        pendingAskPromises.clear();

        shutdownExecutor(scheduler);
        shutdownExecutor(taskExecutor);
    }

    private void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(threadPoolFactory.getSchedulerShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
