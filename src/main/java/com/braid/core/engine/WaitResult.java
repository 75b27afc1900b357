package com.braid.core.engine;

import com.braid.core.model.TaskStatus;

import java.time.Duration;

/**
 * @param taskId    the awaited task
 * @param completed true when the task reached a terminal status
 * @param timedOut  true when the timeout elapsed first
 * @param waitTime  time spent waiting
 * @param status    last observed status (null when the task vanished)
 * @param error     why the wait ended early, if it did
 */
public record WaitResult(
    String taskId,
    boolean completed,
    boolean timedOut,
    Duration waitTime,
    TaskStatus status,
    String error
) {
}
