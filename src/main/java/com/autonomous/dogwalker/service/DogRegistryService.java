package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.NoAgentsConfiguredException;
import com.autonomous.dogwalker.exception.StoreUnavailableException;
import com.autonomous.dogwalker.model.Dog;
import com.autonomous.dogwalker.model.DogStatus;
import com.autonomous.dogwalker.store.CoordinationStore;
import com.autonomous.dogwalker.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks how many tasks each dog is working on and hands new tasks to the
 * least busy one.
 *
 * Counters live in the coordination store so every process sees the same
 * load. When the store cannot be reached, selection falls back to a local
 * round-robin cursor until the store answers again.
 *
 * <p>{@link #assign} serialises selection and marking with a lock local to
 * this process. The even-spread bound (no dog above ceil(N/K) of N
 * simultaneous tasks over K dogs) therefore holds for tasks accepted by one
 * entry process. Several entry processes sharing a store may each pick the
 * same dog in the same instant.
 */
@Service
public class DogRegistryService {

    private static final Logger log = LoggerFactory.getLogger(DogRegistryService.class);

    private final DogRosterService roster;
    private final CoordinationStore store;
    private final StoreKeys keys;

    @Value("${dogwalker.store.retention-hours:24}")
    private long retentionHours = 24;

    private final AtomicInteger roundRobin = new AtomicInteger();
    private final AtomicBoolean degraded = new AtomicBoolean();
    private final ReentrantLock assignLock = new ReentrantLock();

    public DogRegistryService(DogRosterService roster, CoordinationStore store, StoreKeys keys) {
        this.roster = roster;
        this.store = store;
        this.keys = keys;
    }

    /**
     * The dog with the fewest active tasks. Ties go to the dog listed first.
     */
    public Dog selectDog() {
        List<Dog> dogs = roster.getDogs();
        if (dogs.isEmpty()) {
            throw new NoAgentsConfiguredException();
        }
        if (dogs.size() == 1) {
            return dogs.get(0);
        }

        try {
            Dog selected = null;
            long selectedLoad = Long.MAX_VALUE;
            for (Dog dog : dogs) {
                long load = store.getLong(keys.activeTasks(dog.getName()));
                log.debug("Dog {}: {} active tasks", dog.getName(), load);
                if (load < selectedLoad) {
                    selected = dog;
                    selectedLoad = load;
                }
            }
            storeAnswered();
            log.info("Selected dog {} ({} active tasks)", selected.getName(), selectedLoad);
            return selected;
        } catch (StoreUnavailableException e) {
            storeUnreachable(e);
            Dog fallback = dogs.get(Math.floorMod(roundRobin.getAndIncrement(), dogs.size()));
            log.warn("Round-robin selected dog {} while coordination store is unreachable", fallback.getName());
            return fallback;
        }
    }

    /**
     * Selects a dog and marks it busy as one step, so concurrent assignments
     * from this process cannot both pick the same "least busy" dog. Other
     * processes are not covered by the lock.
     */
    public Dog assign(String taskId) {
        assignLock.lock();
        try {
            Dog dog = selectDog();
            markBusy(dog, taskId);
            return dog;
        } finally {
            assignLock.unlock();
        }
    }

    public void markBusy(Dog dog, String taskId) {
        try {
            if (!store.setIfAbsent(keys.dogTask(dog.getName(), taskId), taskId, retention())) {
                log.debug("Task {} already recorded for dog {}", taskId, dog.getName());
                return;
            }
            long count = store.increment(keys.activeTasks(dog.getName()), retention());
            storeAnswered();
            log.info("Marked dog {} busy with task {} ({} active)", dog.getName(), taskId, count);
        } catch (StoreUnavailableException e) {
            storeUnreachable(e);
        }
    }

    /**
     * Releases the dog from a task. Calling it again for the same task does nothing.
     */
    public void markFree(Dog dog, String taskId) {
        markFree(dog.getName(), taskId);
    }

    public void markFree(String dogName, String taskId) {
        try {
            if (!store.delete(keys.dogTask(dogName, taskId))) {
                log.debug("Task {} was not active for dog {}", taskId, dogName);
                return;
            }
            long count = store.decrementFloorZero(keys.activeTasks(dogName));
            storeAnswered();
            log.info("Marked dog {} free from task {} ({} active)", dogName, taskId, count);
        } catch (StoreUnavailableException e) {
            storeUnreachable(e);
        }
    }

    public long getActiveTaskCount(String dogName) {
        try {
            long count = store.getLong(keys.activeTasks(dogName));
            storeAnswered();
            return count;
        } catch (StoreUnavailableException e) {
            storeUnreachable(e);
            return 0;
        }
    }

    public List<DogStatus> getDogStatus() {
        return roster.getDogs().stream()
            .map(dog -> new DogStatus(dog.getName(), dog.getEmail(), getActiveTaskCount(dog.getName())))
            .toList();
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    private Duration retention() {
        return Duration.ofHours(retentionHours);
    }

    private void storeAnswered() {
        if (degraded.compareAndSet(true, false)) {
            log.info("Coordination store reachable again; least-busy selection restored");
        }
    }

    private void storeUnreachable(StoreUnavailableException e) {
        if (degraded.compareAndSet(false, true)) {
            log.warn("Coordination store unreachable, running degraded (round-robin, no load tracking): {}",
                e.getMessage());
        }
    }
}
