package com.verve.test.domain;

import com.verve.domain.worker.model.valobj.WorkerInfo;
import com.verve.domain.worker.service.WorkerRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public class WorkerRegistryTest {

    @Test
    public void shouldKeepConnectedAtAcrossPolls() {
        WorkerRegistry registry = new WorkerRegistry();
        LocalDateTime t0 = LocalDateTime.of(2025, 6, 2, 10, 0);

        registry.recordPollStart("w1", 2, 0, t0);
        registry.recordPollEnd("w1");
        registry.recordPollStart("w1", 4, 1, t0.plusSeconds(30));

        List<WorkerInfo> workers = registry.listWorkers(Duration.ofMinutes(1), t0.plusSeconds(40));
        Assertions.assertEquals(1, workers.size());
        WorkerInfo info = workers.get(0);
        Assertions.assertEquals(t0, info.getConnectedAt());
        Assertions.assertEquals(4, info.getMaxConcurrentTasks());
        Assertions.assertEquals(1, info.getActiveTasks());
        Assertions.assertTrue(info.isPolling());
        Assertions.assertEquals(40000L, info.getUptimeMs());
    }

    @Test
    public void shouldPruneWorkersThatStoppedPolling() {
        WorkerRegistry registry = new WorkerRegistry();
        LocalDateTime t0 = LocalDateTime.of(2025, 6, 2, 10, 0);
        registry.recordPollStart("old", 1, 0, t0);
        registry.recordPollStart("new", 1, 0, t0.plusMinutes(2));

        List<WorkerInfo> workers = registry.listWorkers(Duration.ofMinutes(1), t0.plusMinutes(2));

        Assertions.assertEquals(1, workers.size());
        Assertions.assertEquals("new", workers.get(0).getWorkerId());
        Assertions.assertEquals(1, registry.size());
    }

    @Test
    public void shouldPruneStaleWorkersOnPollWithoutListing() {
        WorkerRegistry registry = new WorkerRegistry(Duration.ofMinutes(2));
        LocalDateTime t0 = LocalDateTime.of(2025, 6, 2, 10, 0);
        for (int i = 0; i < 50; i++) {
            registry.recordPollStart("gone-" + i, 1, 0, t0);
        }
        registry.recordPollStart("steady", 1, 0, t0.plusMinutes(1));
        Assertions.assertEquals(51, registry.size());

        registry.recordPollStart("steady", 1, 0, t0.plusMinutes(3));

        Assertions.assertEquals(1, registry.size());
    }

    @Test
    public void shouldReadStalenessFromMillisAndFallBackWhenInvalid() {
        LocalDateTime t0 = LocalDateTime.of(2025, 6, 2, 10, 0);
        WorkerRegistry shortWindow = new WorkerRegistry(1000L);
        shortWindow.recordPollStart("w1", 1, 0, t0);
        shortWindow.recordPollStart("w2", 1, 0, t0.plusSeconds(5));
        Assertions.assertEquals(1, shortWindow.size());

        WorkerRegistry fallback = new WorkerRegistry(0L);
        fallback.recordPollStart("w1", 1, 0, t0);
        fallback.recordPollStart("w2", 1, 0, t0.plusSeconds(5));
        Assertions.assertEquals(2, fallback.size());
    }

    @Test
    public void shouldIgnoreBlankWorkerId() {
        WorkerRegistry registry = new WorkerRegistry();

        registry.recordPollStart(" ", 1, 0, LocalDateTime.now());

        Assertions.assertEquals(0, registry.size());
    }
}
