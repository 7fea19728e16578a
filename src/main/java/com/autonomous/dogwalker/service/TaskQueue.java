package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.TaskMessage;

/**
 * Hands accepted tasks to the worker pool. Delivery is at-least-once and a
 * given task is processed by one worker at a time.
 */
public interface TaskQueue {

    void enqueue(TaskMessage message);
}
