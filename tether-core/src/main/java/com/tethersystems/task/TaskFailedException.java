package com.tethersystems.task;

import com.tethersystems.ActorException;

/**
 * Thrown when awaiting a linked task that did not complete normally.
 */
public class TaskFailedException extends ActorException {

    public TaskFailedException(String message, Throwable cause, String ownerId) {
        super(message, cause, ownerId);
    }
}
