package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.NoAgentsConfiguredException;
import com.autonomous.dogwalker.exception.StoreUnavailableException;
import com.autonomous.dogwalker.model.Dog;
import com.autonomous.dogwalker.store.CoordinationStore;
import com.autonomous.dogwalker.store.InMemoryCoordinationStore;
import com.autonomous.dogwalker.store.StoreKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DogRegistryServiceTest {

    private final StoreKeys keys = new StoreKeys("test");
    private InMemoryCoordinationStore store;
    private DogRosterService roster;
    private DogRegistryService registry;

    private final Dog coregi = Dog.builder().name("Coregi").email("coregi@example.dev").build();
    private final Dog bitbull = Dog.builder().name("Bitbull").email("bitbull@example.dev").build();

    @BeforeEach
    void setUp() {
        store = new InMemoryCoordinationStore();
        roster = new DogRosterService();
        roster.replaceDogs(List.of(coregi, bitbull));
        registry = new DogRegistryService(roster, store, keys);
    }

    @Test
    void shouldSelectLeastBusyDog() {
        registry.markBusy(bitbull, "t1");
        registry.markBusy(bitbull, "t2");

        Dog selected = registry.selectDog();
        assertEquals("Coregi", selected.getName());

        registry.markBusy(selected, "add rate limiting to /api/login");
        assertEquals(1, registry.getActiveTaskCount("Coregi"));
        assertEquals(2, registry.getActiveTaskCount("Bitbull"));
    }

    @Test
    void shouldBreakTiesByRosterOrder() {
        assertEquals("Coregi", registry.selectDog().getName());

        registry.markBusy(coregi, "t1");
        registry.markBusy(bitbull, "t2");

        assertEquals("Coregi", registry.selectDog().getName());
    }

    @Test
    void shouldFailWhenNoDogsConfigured() {
        roster.replaceDogs(List.of());

        assertThrows(NoAgentsConfiguredException.class, () -> registry.selectDog());
    }

    @Test
    void shouldCountEachTaskOnce() {
        registry.markBusy(coregi, "t1");
        registry.markBusy(coregi, "t1");

        assertEquals(1, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldMakeMarkFreeIdempotent() {
        registry.markBusy(coregi, "t1");
        registry.markBusy(coregi, "t2");

        registry.markFree(coregi, "t1");
        registry.markFree(coregi, "t1");

        assertEquals(1, registry.getActiveTaskCount("Coregi"));

        registry.markFree(coregi, "t2");
        registry.markFree("Coregi", "t2");
        registry.markFree("Coregi", "never-assigned");

        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldSpreadConcurrentAssignmentsEvenly() throws Exception {
        Dog husky = Dog.builder().name("Husky").email("husky@example.dev").build();
        roster.replaceDogs(List.of(coregi, bitbull, husky));

        int tasks = 20;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Dog>> results = new ArrayList<>();
        for (int i = 0; i < tasks; i++) {
            String taskId = "task-" + i;
            results.add(pool.submit(() -> {
                start.await();
                return registry.assign(taskId);
            }));
        }
        start.countDown();
        for (Future<Dog> result : results) {
            result.get();
        }
        pool.shutdown();

        long max = (tasks + 2) / 3;
        long total = 0;
        for (Dog dog : roster.getDogs()) {
            long count = registry.getActiveTaskCount(dog.getName());
            assertTrue(count <= max, dog.getName() + " has " + count + " tasks");
            total += count;
        }
        assertEquals(tasks, total);
    }

    @Test
    void shouldFallBackToRoundRobinWhenStoreIsDown() {
        CoordinationStore broken = mock(CoordinationStore.class);
        when(broken.getLong(anyString())).thenThrow(new StoreUnavailableException("down", null));
        DogRegistryService degradedRegistry = new DogRegistryService(roster, broken, keys);

        assertEquals("Coregi", degradedRegistry.selectDog().getName());
        assertEquals("Bitbull", degradedRegistry.selectDog().getName());
        assertEquals("Coregi", degradedRegistry.selectDog().getName());
        assertTrue(degradedRegistry.isDegraded());
    }

    @Test
    void shouldLeaveDegradedModeOnceStoreAnswers() {
        CoordinationStore flaky = mock(CoordinationStore.class);
        when(flaky.getLong(anyString()))
            .thenThrow(new StoreUnavailableException("down", null))
            .thenReturn(0L);
        DogRegistryService flakyRegistry = new DogRegistryService(roster, flaky, keys);

        flakyRegistry.selectDog();
        assertTrue(flakyRegistry.isDegraded());

        flakyRegistry.selectDog();
        assertFalse(flakyRegistry.isDegraded());
    }
}
