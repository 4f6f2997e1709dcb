package com.tethersystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the threads and pools used by the actor system.
 * Centralizes creation so that actor loops, linked tasks and timers can be tuned in one place.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_SCHEDULER_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    private static final int DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_ACTOR_SHUTDOWN_TIMEOUT_SECONDS = 10;

    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private int schedulerShutdownTimeoutSeconds = DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS;
    private int actorShutdownTimeoutSeconds = DEFAULT_ACTOR_SHUTDOWN_TIMEOUT_SECONDS;
    private boolean daemonThreads = false;

    private ThreadPoolType taskExecutorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = Runtime.getRuntime().availableProcessors();
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Pool used to run linked tasks (event dispatches and lifecycle callbacks).
     */
    public enum ThreadPoolType {
        /**
         * Grows on demand. Handlers that block on a browser round trip each hold a thread,
         * so this is the default.
         */
        CACHED,

        /**
         * Fixed number of threads. Caps concurrency; blocked handlers queue behind each other.
         */
        FIXED,

        /**
         * Work-stealing pool for short CPU-bound handlers.
         */
        WORK_STEALING
    }

    /**
     * Creates a scheduled executor for timers (delayed messages, ask timeouts).
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        return Executors.newScheduledThreadPool(schedulerThreads, createThreadFactory(poolName + "-scheduler"));
    }

    /**
     * Creates the executor that runs linked tasks.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createTaskExecutor(String poolName) {
        switch (taskExecutorType) {
            case CACHED:
                return Executors.newCachedThreadPool(createThreadFactory(poolName + "-task"));
            case FIXED:
                return Executors.newFixedThreadPool(fixedPoolSize, createThreadFactory(poolName + "-task"));
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + taskExecutorType);
        }
    }

    /**
     * Creates a thread factory producing named threads, e.g. {@code actor-conn-42-1}.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    public ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(daemonThreads);
                return thread;
            }
        };
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public int getSchedulerShutdownTimeoutSeconds() {
        return schedulerShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setSchedulerShutdownTimeoutSeconds(int schedulerShutdownTimeoutSeconds) {
        this.schedulerShutdownTimeoutSeconds = schedulerShutdownTimeoutSeconds;
        return this;
    }

    public int getActorShutdownTimeoutSeconds() {
        return actorShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setActorShutdownTimeoutSeconds(int actorShutdownTimeoutSeconds) {
        this.actorShutdownTimeoutSeconds = actorShutdownTimeoutSeconds;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public ThreadPoolType getTaskExecutorType() {
        return taskExecutorType;
    }

    public ThreadPoolFactory setTaskExecutorType(ThreadPoolType taskExecutorType) {
        this.taskExecutorType = taskExecutorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }
}
