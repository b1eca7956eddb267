package com.verve.domain.review.adapter.gateway;

import com.verve.domain.review.model.valobj.CheckResult;
import com.verve.domain.review.model.valobj.Mergeability;
import com.verve.domain.review.model.valobj.PullRequestLink;
import com.verve.domain.review.model.valobj.PullRequestRef;

/**
 * 代码评审平台网关。
 * <p>
 * 调用失败统一抛出 {@code AppException(UPSTREAM_UNAVAILABLE)}，调用方按任务隔离处理。
 * </p>
 */
public interface ICodeReviewPlatform {

    boolean isMerged(PullRequestRef ref);

    Mergeability getMergeability(PullRequestRef ref);

    CheckResult getCombinedCheckStatus(PullRequestRef ref);

    /**
     * 拉取失败检查的日志摘要，无可用日志时返回空串。
     */
    String getFailedCheckLogs(PullRequestRef ref);

    /**
     * 查找分支上已打开的 PR，未找到返回 null。
     */
    default PullRequestLink findPullRequestForBranch(String owner, String repoName, String branchName) {
        return null;
    }
}
