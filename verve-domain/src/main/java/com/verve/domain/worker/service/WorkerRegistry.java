package com.verve.domain.worker.service;

import com.verve.domain.worker.model.valobj.WorkerInfo;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 记录正在长轮询的 worker，进程内有效。
 * 每次轮询开始时顺带清理超过 staleness 未再轮询的条目。
 */
@Service
public class WorkerRegistry {

    private static final Duration DEFAULT_STALENESS = Duration.ofMinutes(2);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, WorkerInfo> workers = new HashMap<>();
    private final Duration staleness;

    public WorkerRegistry() {
        this(DEFAULT_STALENESS);
    }

    @Autowired
    public WorkerRegistry(@Value("${verve.workers.staleness-ms:120000}") long stalenessMillis) {
        this(stalenessMillis <= 0 ? DEFAULT_STALENESS : Duration.ofMillis(stalenessMillis));
    }

    public WorkerRegistry(Duration staleness) {
        this.staleness = staleness;
    }

    public void recordPollStart(String workerId, int maxConcurrentTasks, int activeTasks) {
        recordPollStart(workerId, maxConcurrentTasks, activeTasks, LocalDateTime.now());
    }

    public void recordPollStart(String workerId, int maxConcurrentTasks, int activeTasks, LocalDateTime now) {
        if (StringUtils.isBlank(workerId)) {
            return;
        }
        lock.writeLock().lock();
        try {
            pruneStale(now.minus(staleness));
            WorkerInfo info = workers.get(workerId);
            if (info == null) {
                info = new WorkerInfo();
                info.setWorkerId(workerId);
                info.setConnectedAt(now);
                workers.put(workerId, info);
            }
            info.setMaxConcurrentTasks(maxConcurrentTasks);
            info.setActiveTasks(activeTasks);
            info.setLastPollAt(now);
            info.setPolling(true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordPollEnd(String workerId) {
        if (StringUtils.isBlank(workerId)) {
            return;
        }
        lock.writeLock().lock();
        try {
            WorkerInfo info = workers.get(workerId);
            if (info != null) {
                info.setPolling(false);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<WorkerInfo> listWorkers(Duration staleness) {
        return listWorkers(staleness, LocalDateTime.now());
    }

    /**
     * 列出最近轮询过的 worker，超过 staleness 未轮询的条目会被清理。
     */
    public List<WorkerInfo> listWorkers(Duration staleness, LocalDateTime now) {
        LocalDateTime cutoff = now.minus(staleness);
        List<WorkerInfo> result = new ArrayList<>();
        // 清理需要写锁
        lock.writeLock().lock();
        try {
            pruneStale(cutoff);
            for (WorkerInfo info : workers.values()) {
                WorkerInfo snapshot = info.copy();
                snapshot.setUptimeMs(Duration.between(info.getConnectedAt(), now).toMillis());
                result.add(snapshot);
            }
        } finally {
            lock.writeLock().unlock();
        }
        result.sort(Comparator.comparing(WorkerInfo::getConnectedAt));
        return result;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return workers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void pruneStale(LocalDateTime cutoff) {
        Iterator<Map.Entry<String, WorkerInfo>> it = workers.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().getLastPollAt().isBefore(cutoff)) {
                it.remove();
            }
        }
    }
}
