package com.tethersystems.live;

import com.tethersystems.Actor;
import com.tethersystems.ActorSystem;
import com.tethersystems.SupervisionStrategy;
import com.tethersystems.live.commander.AfterHook;
import com.tethersystems.live.commander.BeforeHook;
import com.tethersystems.live.commander.CommanderBinding;
import com.tethersystems.live.commander.DisconnectCallback;
import com.tethersystems.live.commander.EventHandler;
import com.tethersystems.live.commander.HookSpec;
import com.tethersystems.live.commander.LifecycleCallback;
import com.tethersystems.live.config.TetherConfig;
import com.tethersystems.task.LinkedTaskGroup;
import com.tethersystems.task.TaskExit;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One actor per connected page.
 * <p>
 * The mailbox thread owns {@link ConnectionState}; every lifecycle callback and event dispatch runs
 * as a linked task so a handler waiting on the browser never blocks the mailbox. Dispatches are not
 * ordered against each other. A failing handler is reported and the page is acknowledged anyway;
 * the actor itself keeps running.
 */
public class ConnectionActor extends Actor<ConnectionMessage> {

    public static final String EVENT_HANDLER_KEY = "event_handler_function";
    public static final String ACK_EVENT = "event";
    public static final String ACK_KEY = "finished";

    private final CommanderBinding binding;
    private final FailureReporter reporter;
    private final TetherConfig config;
    private final LinkedTaskGroup tasks;

    private volatile ConnectionState state = ConnectionState.empty();

    public ConnectionActor(ActorSystem system, String actorId, CommanderBinding binding,
                           FailureReporter reporter, TetherConfig config) {
        super(system, actorId);
        this.binding = binding;
        this.reporter = reporter;
        this.config = config;
        this.tasks = new LinkedTaskGroup(getActorId(), system.getTaskExecutor(), this::onTaskExit);
        withSupervisionStrategy(SupervisionStrategy.RESUME);
    }

    @Override
    protected void receive(ConnectionMessage message) {
        if (message instanceof ConnectionMessage.Connect connect) {
            handleConnect(connect);
        } else if (message instanceof ConnectionMessage.Load load) {
            binding.onLoad().ifPresent(callback -> spawnCallback("onload", callback, loadedSocket(load)));
        } else if (message instanceof ConnectionMessage.Event event) {
            handleEvent(event);
        } else if (message instanceof ConnectionMessage.SetField set) {
            state = state.with(set.field(), set.value());
        } else if (message instanceof ConnectionMessage.GetField get) {
            Object value = state.get(get.field());
            getSender().ifPresent(sender -> sender.tell(value));
        } else if (message instanceof ConnectionMessage.ListTasks) {
            getSender().ifPresent(sender -> sender.tell(tasks.active()));
        } else if (message instanceof ConnectionMessage.TaskExited exited) {
            handleTaskExit(exited.exit());
        } else {
            getLogger().warn("Unhandled message {}", message);
        }
    }

    private void handleConnect(ConnectionMessage.Connect connect) {
        Map<String, Object> payload = connect.payload() == null ? Map.of() : connect.payload();
        LiveSocket socket = binding.pipeline().transformConnection(connect.socket(), payload, state);
        state = state.connect(socket);
        getLogger().debug("Connected socket {} with capabilities {}", socket.id(), socket.capabilities());
        binding.onConnect().ifPresent(callback -> spawnCallback("onconnect", callback, socket));
    }

    // the socket stored at connect already went through the pipeline
    private LiveSocket loadedSocket(ConnectionMessage.Load load) {
        if (state.socket() != null) {
            return state.socket();
        }
        return binding.pipeline().transformConnection(load.socket(), Map.of(), state);
    }

    private void handleEvent(ConnectionMessage.Event event) {
        EventInvocation invocation = event.invocation();
        LiveSocket socket = event.socket() != null ? event.socket() : state.socket();
        ConnectionState snapshot = state;
        tasks.spawn("event:" + invocation.handlerName(), () -> dispatch(invocation, socket, snapshot));
    }

    private void spawnCallback(String name, LifecycleCallback callback, LiveSocket socket) {
        tasks.spawn(name, () -> {
            try {
                callback.on(socket);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                reporter.report(socket, e);
            }
        });
    }

    /**
     * Runs one event: handler lookup, capability transforms, before-hooks, handler, after-hooks.
     * Runs on a task thread, never on the mailbox thread.
     */
    void dispatch(EventInvocation invocation, LiveSocket rawSocket, ConnectionState snapshot) {
        LiveSocket socket = rawSocket;
        try {
            String handlerName = invocation.handlerName();
            EventHandler handler = binding.handler(handlerName)
                    .orElseThrow(() -> new HandlerNotFoundException(handlerName));

            Map<String, Object> payload = new LinkedHashMap<>(invocation.payload());
            payload.remove(EVENT_HANDLER_KEY);
            payload = binding.pipeline().transformPayload(payload, snapshot);
            socket = binding.pipeline().transformConnection(socket, payload, snapshot);

            // every before-hook runs, then the gate is checked
            boolean proceed = true;
            for (HookSpec<BeforeHook> spec : binding.beforeHooksFor(handlerName)) {
                if (!spec.hook().before(socket, payload)) {
                    getLogger().debug("Before-hook {} cancelled {}", spec.name(), handlerName);
                    proceed = false;
                }
            }
            if (proceed) {
                Object result = handler.handle(socket, payload);
                List<HookSpec<AfterHook>> afterHooks = binding.afterHooksFor(handlerName);
                for (HookSpec<AfterHook> spec : afterHooks) {
                    spec.hook().after(socket, payload, result);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            getLogger().debug("Dispatch of {} interrupted", invocation.handlerName());
        } catch (Exception e) {
            reporter.report(socket, e);
        } finally {
            acknowledge(rawSocket, invocation.replyToken());
        }
    }

    private void acknowledge(LiveSocket socket, Object replyToken) {
        if (socket == null) {
            getLogger().warn("No socket to acknowledge {}", replyToken);
            return;
        }
        Map<String, Object> ack = new HashMap<>();
        ack.put(ACK_KEY, replyToken);
        try {
            socket.push(ACK_EVENT, ack);
        } catch (RuntimeException e) {
            getLogger().warn("Could not acknowledge {} on {}", replyToken, socket.id(), e);
        }
    }

    private void onTaskExit(TaskExit exit) {
        if (isRunning()) {
            tell(new ConnectionMessage.TaskExited(exit));
        } else {
            getLogger().debug("Task {} exited after stop: {}", exit.taskId(), exit.reason());
        }
    }

    private void handleTaskExit(TaskExit exit) {
        switch (exit.reason()) {
            case NORMAL:
                break;
            case KILLED:
                reporter.report(state.socket(), "Task " + exit.taskId() + " (" + exit.name() + ") has been killed.");
                break;
            case FAILED:
                getLogger().error("Task {} ({}) died", exit.taskId(), exit.name(), exit.cause());
                break;
            default:
                getLogger().warn("Unknown exit reason {}", exit.reason());
        }
    }

    @Override
    protected void postStop() {
        binding.onDisconnect().ifPresent(this::runDisconnect);
        int killed = tasks.killAll();
        tasks.close();
        if (killed > 0) {
            getLogger().debug("Killed {} running tasks on stop", killed);
        }
        super.postStop();
    }

    private void runDisconnect(DisconnectCallback callback) {
        ConnectionState last = state;
        Future<?> future;
        try {
            future = getSystem().getTaskExecutor().submit(() -> {
                callback.onDisconnect(last.store(), last.session());
                return null;
            });
        } catch (RejectedExecutionException e) {
            getLogger().warn("On-disconnect callback not run, executor is shut down");
            return;
        }
        long timeoutMillis = config.getDisconnectTimeout().toMillis();
        try {
            future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            getLogger().warn("On-disconnect callback did not finish within {} ms, cancelling it", timeoutMillis);
            future.cancel(true);
        } catch (ExecutionException e) {
            reporter.report(null, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Current state. Safe to read from any thread; only the mailbox thread writes it.
     *
     * @return the state
     */
    public ConnectionState state() {
        return state;
    }

    public CommanderBinding binding() {
        return binding;
    }
}
