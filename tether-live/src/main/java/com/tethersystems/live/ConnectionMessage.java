package com.tethersystems.live;

import com.tethersystems.task.TaskExit;

import java.util.Map;

/**
 * Messages understood by {@link ConnectionActor}.
 */
public sealed interface ConnectionMessage {

    record Connect(LiveSocket socket, Map<String, Object> payload) implements ConnectionMessage {
    }

    record Load(LiveSocket socket) implements ConnectionMessage {
    }

    record Event(EventInvocation invocation, LiveSocket socket) implements ConnectionMessage {
    }

    record SetField(ConnectionState.Field field, Object value) implements ConnectionMessage {
    }

    /** Asked; the reply is the field's current value. */
    record GetField(ConnectionState.Field field) implements ConnectionMessage {
    }

    /** Asked; the reply is the list of running task handles. */
    record ListTasks() implements ConnectionMessage {
    }

    record TaskExited(TaskExit exit) implements ConnectionMessage {
    }
}
