package com.tethersystems.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Tasks linked to an owning actor.
 * <p>
 * Each task runs on the shared executor and reports exactly one {@link TaskExit} to the owner's
 * exit listener. Tasks do not wait for each other, so a task blocked on a remote reply never holds
 * up the owner or its sibling tasks. Closing the group kills whatever is still running.
 */
public class LinkedTaskGroup implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LinkedTaskGroup.class);

    private final String ownerId;
    private final ExecutorService executor;
    private final Consumer<TaskExit> exitListener;
    private final Map<String, LinkedTask<?>> active = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();
    private volatile boolean closed = false;

    /**
     * @param ownerId      Id of the owning actor, used in task ids and logs
     * @param executor     Executor the tasks run on
     * @param exitListener Receives every task's exit signal; must not block
     */
    public LinkedTaskGroup(String ownerId, ExecutorService executor, Consumer<TaskExit> exitListener) {
        this.ownerId = ownerId;
        this.executor = executor;
        this.exitListener = exitListener;
    }

    /**
     * Starts a task linked to the owner.
     *
     * @param name A descriptive name, e.g. the handler being run
     * @param body The work
     * @param <T>  The result type
     * @return a handle to the task
     * @throws IllegalStateException if the group is closed
     */
    public <T> TaskHandle<T> spawn(String name, Callable<T> body) {
        if (closed) {
            throw new IllegalStateException("Task group of " + ownerId + " is closed");
        }
        String taskId = ownerId + "-task-" + counter.incrementAndGet();
        LinkedTask<T> task = new LinkedTask<>(taskId, name, body);
        active.put(taskId, task);
        try {
            task.start();
        } catch (RejectedExecutionException e) {
            active.remove(taskId);
            task.exit(TaskExit.failed(taskId, name, e));
            logger.warn("Task {} ({}) rejected by executor", taskId, name);
        }
        return task;
    }

    /**
     * Spawns a task with no result.
     *
     * @param name A descriptive name
     * @param body The work
     * @return a handle to the task
     */
    public TaskHandle<Void> spawn(String name, Runnable body) {
        return spawn(name, () -> {
            body.run();
            return null;
        });
    }

    public int activeCount() {
        return active.size();
    }

    public List<TaskHandle<?>> active() {
        return List.copyOf(active.values());
    }

    /**
     * Kills every running task.
     *
     * @return the number of tasks killed
     */
    public int killAll() {
        int killed = 0;
        for (LinkedTask<?> task : List.copyOf(active.values())) {
            if (task.kill()) {
                killed++;
            }
        }
        return killed;
    }

    @Override
    public void close() {
        closed = true;
        int killed = killAll();
        if (killed > 0) {
            logger.debug("Killed {} running tasks of {}", killed, ownerId);
        }
    }

    public String getOwnerId() {
        return ownerId;
    }

    private final class LinkedTask<T> implements TaskHandle<T> {
        private final String id;
        private final String name;
        private final Callable<T> body;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean exited = new AtomicBoolean(false);
        private volatile Future<?> submission;

        LinkedTask(String id, String name, Callable<T> body) {
            this.id = id;
            this.name = name;
            this.body = body;
        }

        void start() {
            submission = executor.submit(this::run);
            if (exited.get()) {
                submission.cancel(true);
            }
        }

        private void run() {
            try {
                if (exited.get()) {
                    return;
                }
                T value = body.call();
                result.complete(value);
                exit(TaskExit.normal(id, name));
            } catch (InterruptedException e) {
                result.completeExceptionally(e);
                exit(TaskExit.normal(id, name));
            } catch (Throwable e) {
                result.completeExceptionally(e);
                exit(TaskExit.failed(id, name, e));
            } finally {
                // clear a kill interrupt that arrived after the body returned
                Thread.interrupted();
            }
        }

        /**
         * Delivers the exit signal once; later calls are ignored.
         */
        boolean exit(TaskExit signal) {
            if (!exited.compareAndSet(false, true)) {
                return false;
            }
            active.remove(id);
            if (signal.reason() == TaskExit.Reason.FAILED) {
                result.completeExceptionally(signal.cause());
            }
            try {
                exitListener.accept(signal);
            } catch (RuntimeException e) {
                logger.error("Exit listener of {} failed for task {}", ownerId, id, e);
            }
            return true;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean kill() {
            if (!exit(TaskExit.killed(id, name))) {
                return false;
            }
            result.completeExceptionally(new CancellationException("Task " + id + " was killed"));
            // cancel(true) interrupts only this task's run, never a later task on the same pooled thread
            Future<?> submitted = submission;
            if (submitted != null) {
                submitted.cancel(true);
            }
            return true;
        }

        @Override
        public boolean isDone() {
            return exited.get();
        }

        @Override
        public T await() {
            try {
                return result.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskFailedException("Interrupted awaiting task " + id, e, ownerId);
            } catch (ExecutionException | CancellationException e) {
                throw new TaskFailedException("Task " + id + " (" + name + ") did not complete", unwrap(e), ownerId);
            }
        }

        @Override
        public T await(Duration timeout) throws TimeoutException {
            try {
                return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskFailedException("Interrupted awaiting task " + id, e, ownerId);
            } catch (ExecutionException | CancellationException e) {
                throw new TaskFailedException("Task " + id + " (" + name + ") did not complete", unwrap(e), ownerId);
            }
        }

        @Override
        public CompletableFuture<T> future() {
            return result;
        }

        private Throwable unwrap(Exception e) {
            return e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        }
    }
}
