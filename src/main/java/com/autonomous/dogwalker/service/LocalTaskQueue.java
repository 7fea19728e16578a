package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.TaskMessage;
import com.autonomous.dogwalker.model.TaskReport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker pool. Each worker runs one task at a time, start to finish.
 */
@Component
public class LocalTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(LocalTaskQueue.class);

    private final TaskRunner runner;
    private final ExecutorService executor;

    public LocalTaskQueue(TaskRunner runner, @Value("${dogwalker.worker.threads:4}") int threads) {
        this.runner = runner;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, task -> {
            Thread worker = new Thread(task, "dog-worker-" + counter.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        });
    }

    @Override
    public void enqueue(TaskMessage message) {
        executor.submit(() -> {
            try {
                TaskReport report = runner.run(message);
                log.info("Task {} ended {} after {}s", report.getTaskId(), report.getFinalPhase(),
                    report.getElapsed().toSeconds());
            } catch (RuntimeException e) {
                log.error("Worker crashed on task {}", message.getTaskId(), e);
            }
        });
        log.info("Queued task {} for {}", message.getTaskId(), message.getAgentName());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
