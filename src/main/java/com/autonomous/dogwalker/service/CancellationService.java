package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.DogwalkerException;
import com.autonomous.dogwalker.model.CancellationInfo;
import com.autonomous.dogwalker.model.TaskProgress;
import com.autonomous.dogwalker.store.CoordinationStore;
import com.autonomous.dogwalker.store.StoreKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Cooperative cancellation. A request only raises a flag; the dog looks at
 * it at its next checkpoint, after the operation it is in has finished.
 * The flag never lapses while a task can still run: it is kept for the store
 * retention period and cleared once the cancellation report is out.
 */
@Service
public class CancellationService {

    private static final Logger log = LoggerFactory.getLogger(CancellationService.class);

    private final CoordinationStore store;
    private final StoreKeys keys;
    private final Clock clock;
    private final ObjectMapper mapper;

    @Value("${dogwalker.store.retention-hours:24}")
    private long retentionHours = 24;

    public CancellationService(CoordinationStore store, StoreKeys keys, Clock clock) {
        this.store = store;
        this.keys = keys;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    /**
     * Raises the cancellation flag. The first request wins; later ones keep
     * the original actor and time.
     *
     * @return true if this call raised the flag
     */
    public boolean requestCancel(String taskId, String actorName, String actorId) {
        CancellationInfo info = CancellationInfo.builder()
            .cancelledBy(actorName)
            .cancelledById(actorId)
            .requestedAt(clock.instant())
            .build();

        boolean raised = store.setIfAbsent(keys.cancel(taskId), write(info), Duration.ofHours(retentionHours));
        if (raised) {
            log.info("Cancellation requested for task {} by {}", taskId, actorName);
        } else {
            log.info("Task {} already has a pending cancellation; ignoring request by {}", taskId, actorName);
        }
        return raised;
    }

    public Optional<CancellationInfo> isCancelled(String taskId) {
        return store.get(keys.cancel(taskId)).map(json -> read(json, CancellationInfo.class));
    }

    public void clearCancellation(String taskId) {
        if (store.delete(keys.cancel(taskId))) {
            log.info("Cleared cancellation signal for task {}", taskId);
        }
    }

    /** Last known progress, written at every phase boundary. */
    public void recordProgress(String taskId, TaskProgress progress) {
        store.set(keys.progress(taskId), write(progress), Duration.ofHours(retentionHours));
    }

    public Optional<TaskProgress> lastProgress(String taskId) {
        return store.get(keys.progress(taskId)).map(json -> read(json, TaskProgress.class));
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DogwalkerException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DogwalkerException("Could not read " + type.getSimpleName() + " from store", e);
        }
    }
}
