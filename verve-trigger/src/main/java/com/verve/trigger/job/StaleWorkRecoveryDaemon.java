package com.verve.trigger.job;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.trigger.application.command.TaskCommandService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 心跳超时回收守护进程：running 任务重新排队，规划中的 epic 释放领取。
 */
@Slf4j
@Component
public class StaleWorkRecoveryDaemon {

    private final TaskCommandService taskCommandService;
    private final EpicCommandService epicCommandService;
    private final Duration taskTimeout;
    private final Duration epicTimeout;
    private final Counter requeueCounter;

    public StaleWorkRecoveryDaemon(TaskCommandService taskCommandService,
                                   EpicCommandService epicCommandService,
                                   @Value("${verve.recovery.task-timeout-ms:300000}") long taskTimeoutMillis,
                                   @Value("${verve.recovery.epic-timeout-ms:300000}") long epicTimeoutMillis) {
        this.taskCommandService = taskCommandService;
        this.epicCommandService = epicCommandService;
        this.taskTimeout = Duration.ofMillis(taskTimeoutMillis > 0 ? taskTimeoutMillis : 300000L);
        this.epicTimeout = Duration.ofMillis(epicTimeoutMillis > 0 ? epicTimeoutMillis : 300000L);
        this.requeueCounter = Counter.builder("verve.recovery.requeue.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${verve.recovery.interval-ms:60000}", scheduler = "daemonScheduler")
    public void recover() {
        try {
            requeueStaleTasks(LocalDateTime.now().minus(taskTimeout));
        } catch (Exception ex) {
            log.warn("Stale task sweep failed. error={}", ex.getMessage());
        }
        try {
            int released = epicCommandService.timeoutStaleEpics(epicTimeout);
            if (released > 0) {
                log.info("Stale epic sweep finished. released={}", released);
            }
        } catch (Exception ex) {
            log.warn("Stale epic sweep failed. error={}", ex.getMessage());
        }
    }

    public int requeueStaleTasks(LocalDateTime cutoff) {
        List<TaskEntity> stale = taskCommandService.findStaleRunning(cutoff);
        int requeued = 0;
        for (TaskEntity task : stale) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                if (taskCommandService.requeueStaleTask(task.getId(), cutoff)) {
                    requeued++;
                    requeueCounter.increment();
                    log.info("Stale task requeued. taskId={}, attempt={}, lastHeartbeatAt={}", task.getId(),
                            task.getAttempt() + 1, task.getLastHeartbeatAt());
                }
            } catch (Exception ex) {
                log.warn("Requeue stale task failed. taskId={}, error={}", task.getId(), ex.getMessage());
            }
        }
        return requeued;
    }
}
