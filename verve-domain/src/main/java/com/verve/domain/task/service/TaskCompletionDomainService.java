package com.verve.domain.task.service;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.valobj.TaskCompletionReport;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Task 完成判定领域服务：根据 worker 上报结果决定任务去向。
 */
@Service
public class TaskCompletionDomainService {

    public static final String RATE_LIMIT_PREFIX = "rate_limit: ";
    public static final String NO_CHANGES_REASON = "No changes needed: the codebase already meets the required criteria";

    public CompletionDecision decide(TaskEntity task, TaskCompletionReport report) {
        boolean hasPrereqFailure = StringUtils.isNotBlank(report.getPrereqFailed());
        if (!report.isSuccess()) {
            if (report.isRetryable() && !hasPrereqFailure) {
                return CompletionDecision.SCHEDULE_RETRY;
            }
            if (!hasPrereqFailure && (task.hasPullRequest() || task.hasBranch())) {
                return CompletionDecision.REVIEW;
            }
            return CompletionDecision.FAIL;
        }
        if (StringUtils.isNotBlank(report.getPullRequestUrl())) {
            return CompletionDecision.SET_PULL_REQUEST;
        }
        if (StringUtils.isNotBlank(report.getBranchName())) {
            return CompletionDecision.SET_BRANCH;
        }
        if (task.hasPullRequest() || task.hasBranch()) {
            return CompletionDecision.REVIEW;
        }
        return CompletionDecision.CLOSE;
    }

    public String retryReason(TaskCompletionReport report) {
        return RATE_LIMIT_PREFIX + StringUtils.defaultString(report.getError());
    }

    /**
     * 失败路径只记录前置条件失败；关闭路径只在 noChanges 时记录。
     */
    public String closeReason(TaskCompletionReport report, CompletionDecision decision) {
        if (StringUtils.isNotBlank(report.getPrereqFailed())) {
            return report.getPrereqFailed();
        }
        if (decision == CompletionDecision.CLOSE && report.isNoChanges()) {
            return NO_CHANGES_REASON;
        }
        return null;
    }

    public enum CompletionDecision {
        SCHEDULE_RETRY,
        FAIL,
        REVIEW,
        SET_PULL_REQUEST,
        SET_BRANCH,
        CLOSE
    }
}
