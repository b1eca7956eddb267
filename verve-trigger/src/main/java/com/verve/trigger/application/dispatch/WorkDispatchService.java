package com.verve.trigger.application.dispatch;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.EpicFeedback;
import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.worker.service.WorkerRegistry;
import com.verve.trigger.application.command.CodeHostTokenService;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.trigger.application.command.RepoCommandService;
import com.verve.trigger.application.command.TaskCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Worker 长轮询分发：epic 优先，其次 task；都没有时在信号上等待直至超时。
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Service
public class WorkDispatchService {

    private final TaskCommandService taskCommandService;
    private final EpicCommandService epicCommandService;
    private final RepoCommandService repoCommandService;
    private final CodeHostTokenService codeHostTokenService;
    private final WorkerRegistry workerRegistry;
    private final PendingWorkSignal pendingWorkSignal;
    private final long pollTimeoutMillis;
    private final long feedbackTimeoutMillis;

    public WorkDispatchService(TaskCommandService taskCommandService,
                               EpicCommandService epicCommandService,
                               RepoCommandService repoCommandService,
                               CodeHostTokenService codeHostTokenService,
                               WorkerRegistry workerRegistry,
                               PendingWorkSignal pendingWorkSignal,
                               @Value("${verve.dispatch.poll-timeout-ms:30000}") long pollTimeoutMillis,
                               @Value("${verve.dispatch.max-hold-ms:60000}") long maxHoldMillis,
                               @Value("${verve.dispatch.feedback-timeout-ms:30000}") long feedbackTimeoutMillis) {
        this.taskCommandService = taskCommandService;
        this.epicCommandService = epicCommandService;
        this.repoCommandService = repoCommandService;
        this.codeHostTokenService = codeHostTokenService;
        this.workerRegistry = workerRegistry;
        this.pendingWorkSignal = pendingWorkSignal;
        long maxHold = maxHoldMillis <= 0 ? 60000L : maxHoldMillis;
        this.pollTimeoutMillis = Math.min(pollTimeoutMillis <= 0 ? 30000L : pollTimeoutMillis, maxHold);
        this.feedbackTimeoutMillis = Math.min(feedbackTimeoutMillis <= 0 ? 30000L : feedbackTimeoutMillis, maxHold);
    }

    public long getPollTimeoutMillis() {
        return pollTimeoutMillis;
    }

    public long getFeedbackTimeoutMillis() {
        return feedbackTimeoutMillis;
    }

    /**
     * 阻塞直到领取到工作或超时，超时返回 null。线程中断时抛出 InterruptedException。
     */
    public WorkAssignment awaitWork(String workerId, int maxConcurrentTasks, int activeTasks,
                                    List<String> repoIds) throws InterruptedException {
        workerRegistry.recordPollStart(workerId, maxConcurrentTasks, activeTasks);
        try {
            long deadline = System.currentTimeMillis() + pollTimeoutMillis;
            while (true) {
                long seen = pendingWorkSignal.generation();
                WorkAssignment assignment = tryDispatch(repoIds);
                if (assignment != null) {
                    log.info("Work dispatched. workerId={}, type={}, id={}", workerId, assignment.getType(),
                            assignment.getTask() != null ? assignment.getTask().getId() : assignment.getEpic().getId());
                    return assignment;
                }
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0 || !pendingWorkSignal.awaitChange(seen, remaining)) {
                    return null;
                }
            }
        } finally {
            workerRegistry.recordPollEnd(workerId);
        }
    }

    /**
     * 单次领取尝试，不等待。
     */
    public WorkAssignment tryDispatch(List<String> repoIds) {
        EpicEntity epic = epicCommandService.claimPendingEpic();
        if (epic != null) {
            RepoEntity repo = repoCommandService.requireRepo(epic.getRepoId());
            return new WorkAssignment(WorkAssignment.TYPE_EPIC, null, epic, repo.getFullName(),
                    codeHostTokenService.readToken());
        }
        TaskEntity task = taskCommandService.claimPendingTask(repoIds);
        if (task != null) {
            RepoEntity repo = repoCommandService.requireRepo(task.getRepoId());
            return new WorkAssignment(WorkAssignment.TYPE_TASK, task, null, repo.getFullName(),
                    codeHostTokenService.readToken());
        }
        return null;
    }

    /**
     * 规划 worker 等待用户反馈，超时返回 null。
     */
    public EpicFeedback awaitEpicFeedback(String epicId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + feedbackTimeoutMillis;
        while (true) {
            long seen = pendingWorkSignal.generation();
            EpicFeedback feedback = epicCommandService.pollFeedback(epicId);
            if (feedback != null) {
                return feedback;
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0 || !pendingWorkSignal.awaitChange(seen, remaining)) {
                return null;
            }
        }
    }
}
