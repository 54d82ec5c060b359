package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.TaskStatus;

/**
 * Thrown when a task status change is not allowed, including any write to a
 * task that is already COMPLETED, FAILED or CANCELLED.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
    }
}
