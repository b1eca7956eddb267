package com.verve.trigger.job;

import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.domain.review.adapter.gateway.ICodeReviewPlatform;
import com.verve.domain.review.model.valobj.CheckResult;
import com.verve.domain.review.model.valobj.Mergeability;
import com.verve.domain.review.model.valobj.PullRequestLink;
import com.verve.domain.review.model.valobj.PullRequestRef;
import com.verve.domain.review.service.ReviewRetryPolicyDomainService;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.trigger.application.command.RepoCommandService;
import com.verve.trigger.application.command.TaskCommandService;
import com.verve.types.enums.CheckStatusEnum;
import com.verve.types.enums.ResponseCode;
import com.verve.types.enums.TaskStatusEnum;
import com.verve.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * review 任务与代码评审平台对账守护进程。
 * <p>
 * 第一轮为只有分支的任务关联 PR；第二轮按 合并 > 冲突 > CI 失败 > 检查进行中 的顺序处理每个 PR。
 * 单个任务失败只记录日志，不影响同轮其他任务。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Component
public class PullRequestReconcileDaemon {

    private final ObjectProvider<ICodeReviewPlatform> codeReviewPlatformProvider;
    private final TaskCommandService taskCommandService;
    private final RepoCommandService repoCommandService;
    private final ReviewRetryPolicyDomainService reviewRetryPolicy;
    private final Counter mergedCounter;
    private final Counter retryCounter;

    public PullRequestReconcileDaemon(ObjectProvider<ICodeReviewPlatform> codeReviewPlatformProvider,
                                      TaskCommandService taskCommandService,
                                      RepoCommandService repoCommandService,
                                      ReviewRetryPolicyDomainService reviewRetryPolicy) {
        this.codeReviewPlatformProvider = codeReviewPlatformProvider;
        this.taskCommandService = taskCommandService;
        this.repoCommandService = repoCommandService;
        this.reviewRetryPolicy = reviewRetryPolicy;
        this.mergedCounter = Counter.builder("verve.reconcile.merged.total").register(Metrics.globalRegistry);
        this.retryCounter = Counter.builder("verve.reconcile.retry.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${verve.reconcile.interval-ms:30000}", scheduler = "reconcileScheduler")
    public void reconcile() {
        ICodeReviewPlatform platform = codeReviewPlatformProvider.getIfAvailable();
        if (platform == null) {
            return;
        }
        reconcileOnce(platform);
    }

    public void reconcileOnce(ICodeReviewPlatform platform) {
        Map<String, RepoEntity> repoCache = new HashMap<>();
        linkBranchPullRequests(platform, repoCache);
        List<TaskEntity> reviewTasks = taskCommandService.listTasksByStatus(TaskStatusEnum.REVIEW);
        for (TaskEntity task : reviewTasks) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Reconcile interrupted, stopping between tasks.");
                return;
            }
            if (task.getPrNumber() <= 0) {
                continue;
            }
            try {
                reconcileTask(platform, task, resolveRepo(task.getRepoId(), repoCache));
            } catch (AppException ex) {
                logTaskFailure(task, ex);
            } catch (Exception ex) {
                log.warn("Reconcile task failed. taskId={}, prNumber={}, error={}", task.getId(), task.getPrNumber(),
                        ex.getMessage());
            }
        }
    }

    private void linkBranchPullRequests(ICodeReviewPlatform platform, Map<String, RepoEntity> repoCache) {
        for (TaskEntity task : taskCommandService.listReviewTasksWithoutPullRequest()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            try {
                RepoEntity repo = resolveRepo(task.getRepoId(), repoCache);
                PullRequestLink link = platform.findPullRequestForBranch(repo.getOwner(), repo.getName(), task.getBranchName());
                if (link == null || link.getNumber() <= 0) {
                    continue;
                }
                taskCommandService.setPullRequest(task.getId(), link.getUrl(), link.getNumber());
                log.info("Linked branch to pull request. taskId={}, branch={}, prNumber={}", task.getId(),
                        task.getBranchName(), link.getNumber());
            } catch (AppException ex) {
                logTaskFailure(task, ex);
            } catch (Exception ex) {
                log.warn("Branch PR lookup failed. taskId={}, branch={}, error={}", task.getId(), task.getBranchName(),
                        ex.getMessage());
            }
        }
    }

    private void reconcileTask(ICodeReviewPlatform platform, TaskEntity task, RepoEntity repo) {
        PullRequestRef ref = new PullRequestRef(repo.getOwner(), repo.getName(), task.getPrNumber());
        if (platform.isMerged(ref)) {
            taskCommandService.markMerged(task.getId());
            mergedCounter.increment();
            return;
        }
        Mergeability mergeability = platform.getMergeability(ref);
        if (mergeability != null && mergeability.hasConflicts()) {
            log.info("PR has conflicts, retrying task. taskId={}, prNumber={}", task.getId(), task.getPrNumber());
            taskCommandService.retryTask(task.getId(), ReviewRetryPolicyDomainService.MERGE_CONFLICT_CATEGORY,
                    ReviewRetryPolicyDomainService.MERGE_CONFLICT_REASON, null);
            retryCounter.increment();
            return;
        }
        CheckResult checks = platform.getCombinedCheckStatus(ref);
        if (checks == null || checks.getStatus() != CheckStatusEnum.FAILURE) {
            return;
        }
        String retryContext = null;
        try {
            retryContext = platform.getFailedCheckLogs(ref);
        } catch (Exception ex) {
            log.warn("Fetch failed check logs failed, retrying without context. taskId={}, prNumber={}, error={}",
                    task.getId(), task.getPrNumber(), ex.getMessage());
        }
        String category = reviewRetryPolicy.ciFailureCategory(checks);
        String reason = reviewRetryPolicy.ciFailureReason(checks);
        log.info("CI failed, retrying task. taskId={}, prNumber={}, category={}", task.getId(), task.getPrNumber(), category);
        taskCommandService.retryTask(task.getId(), category, reason, retryContext);
        retryCounter.increment();
    }

    private RepoEntity resolveRepo(String repoId, Map<String, RepoEntity> repoCache) {
        RepoEntity cached = repoCache.get(repoId);
        if (cached != null) {
            return cached;
        }
        RepoEntity repo = repoCommandService.requireRepo(repoId);
        repoCache.put(repoId, repo);
        return repo;
    }

    private void logTaskFailure(TaskEntity task, AppException ex) {
        if (ex.is(ResponseCode.PRECONDITION_FAILED)) {
            log.debug("Reconcile lost race. taskId={}, info={}", task.getId(), ex.getInfo());
            return;
        }
        log.warn("Reconcile task failed. taskId={}, code={}, info={}", task.getId(), ex.getCode(), ex.getInfo());
    }
}
