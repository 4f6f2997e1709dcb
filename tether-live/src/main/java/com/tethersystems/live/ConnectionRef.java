package com.tethersystems.live;

import com.tethersystems.Pid;
import com.tethersystems.Reply;
import com.tethersystems.ReplyException;
import com.tethersystems.task.TaskHandle;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Handler-facing view of a connection actor's state. Getters ask the actor and wait;
 * setters are asynchronous and replace the whole field.
 */
public final class ConnectionRef {

    private final Pid pid;
    private final Duration timeout;

    public ConnectionRef(Pid pid, Duration timeout) {
        this.pid = pid;
        this.timeout = timeout;
    }

    public Pid pid() {
        return pid;
    }

    public Map<String, Object> getStore() {
        return get(ConnectionState.Field.STORE);
    }

    public void setStore(Map<String, Object> store) {
        set(ConnectionState.Field.STORE, store);
    }

    public Map<String, Object> getSession() {
        return get(ConnectionState.Field.SESSION);
    }

    public void setSession(Map<String, Object> session) {
        set(ConnectionState.Field.SESSION, session);
    }

    public LiveSocket getSocket() {
        return get(ConnectionState.Field.SOCKET);
    }

    public void setSocket(LiveSocket socket) {
        set(ConnectionState.Field.SOCKET, socket);
    }

    public Map<String, Object> getPrivate() {
        return get(ConnectionState.Field.PRIVATE);
    }

    public void setPrivate(Map<String, Object> privateData) {
        set(ConnectionState.Field.PRIVATE, privateData);
    }

    /**
     * Linked tasks still running on the connection: dispatches and lifecycle callbacks.
     *
     * @return handles of the running tasks
     */
    public List<TaskHandle<?>> activeTasks() {
        return ask(new ConnectionMessage.ListTasks());
    }

    /**
     * Reads a field through the actor's mailbox, so a preceding set from the same thread is visible.
     *
     * @param field The field
     * @param <T>   The field type
     * @return the current value
     * @throws TetherException if the actor does not answer within the state timeout
     */
    public <T> T get(ConnectionState.Field field) {
        return ask(new ConnectionMessage.GetField(field));
    }

    public void set(ConnectionState.Field field, Object value) {
        pid.tell(new ConnectionMessage.SetField(field, value));
    }

    private <T> T ask(ConnectionMessage message) {
        Reply<T> reply = pid.system().ask(pid, message, timeout);
        try {
            return reply.get();
        } catch (ReplyException e) {
            throw new TetherException("Connection " + pid.actorId() + " did not answer " + message, e.getCause());
        }
    }

    @Override
    public String toString() {
        return "ConnectionRef[" + pid.actorId() + "]";
    }
}
