package com.autonomous.dogwalker.store;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Namespaced key patterns for everything kept in the coordination store.
 */
@Component
public class StoreKeys {

    @Value("${dogwalker.store.namespace:dogwalker}")
    private String namespace = "dogwalker";

    public StoreKeys() {
    }

    public StoreKeys(String namespace) {
        this.namespace = namespace;
    }

    public String threadTask(String threadTs) {
        return key("thread_tasks", threadTs);
    }

    public String taskThread(String taskId) {
        return key("task_threads", taskId);
    }

    public String threadMessages(String threadTs) {
        return key("thread_messages", threadTs);
    }

    public String readPointer(String taskId) {
        return key("read_pointer", taskId);
    }

    public String activeTasks(String dogName) {
        return key("active_tasks", dogName);
    }

    public String dogTask(String dogName, String taskId) {
        return key("dog_tasks", dogName + ":" + taskId);
    }

    public String cancel(String taskId) {
        return key("cancel", taskId);
    }

    public String progress(String taskId) {
        return key("task_progress", taskId);
    }

    private String key(String pattern, String id) {
        return namespace + ":" + pattern + ":" + id;
    }
}
