package com.tethersystems.task;

/**
 * Exit signal of a linked task, delivered exactly once per task to the group's owner.
 *
 * @param taskId Unique id of the task within its group
 * @param name   Descriptive name given at spawn time
 * @param reason Why the task ended
 * @param cause  The failure, present only for {@link Reason#FAILED}
 */
public record TaskExit(String taskId, String name, Reason reason, Throwable cause) {

    public enum Reason {
        /** The task returned or was interrupted by its own code. */
        NORMAL,
        /** The task was killed through its handle or its group. */
        KILLED,
        /** The task threw. */
        FAILED
    }

    public static TaskExit normal(String taskId, String name) {
        return new TaskExit(taskId, name, Reason.NORMAL, null);
    }

    public static TaskExit killed(String taskId, String name) {
        return new TaskExit(taskId, name, Reason.KILLED, null);
    }

    public static TaskExit failed(String taskId, String name, Throwable cause) {
        return new TaskExit(taskId, name, Reason.FAILED, cause);
    }

    public boolean isNormal() {
        return reason == Reason.NORMAL;
    }
}
