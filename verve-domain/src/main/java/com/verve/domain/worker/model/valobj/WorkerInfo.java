package com.verve.domain.worker.model.valobj;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 正在轮询的 worker 快照（进程内，不持久化）。
 */
@Data
public class WorkerInfo {

    private String workerId;
    private int maxConcurrentTasks;
    private int activeTasks;
    private LocalDateTime connectedAt;
    private LocalDateTime lastPollAt;
    private long uptimeMs;
    private boolean polling;

    public WorkerInfo copy() {
        WorkerInfo copy = new WorkerInfo();
        copy.setWorkerId(workerId);
        copy.setMaxConcurrentTasks(maxConcurrentTasks);
        copy.setActiveTasks(activeTasks);
        copy.setConnectedAt(connectedAt);
        copy.setLastPollAt(lastPollAt);
        copy.setUptimeMs(uptimeMs);
        copy.setPolling(polling);
        return copy;
    }
}
