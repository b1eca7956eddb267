package com.verve.infrastructure.dao;

import com.verve.infrastructure.dao.po.TaskPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 任务 DAO，条件更新返回受影响行数。
 *
 * @author verve
 * @since 2025-06-02
 */
@Mapper
public interface TaskDao {

    int insert(TaskPO po);

    TaskPO selectById(@Param("id") String id);

    int countById(@Param("id") String id);

    List<TaskPO> selectByIds(@Param("ids") Collection<String> ids);

    List<TaskPO> selectAll();

    List<TaskPO> selectByRepoId(@Param("repoId") String repoId);

    List<TaskPO> selectByStatus(@Param("status") String status);

    /**
     * pending 且 ready，repoIds 为空时不限仓库
     */
    List<TaskPO> selectClaimCandidates(@Param("repoIds") List<String> repoIds);

    List<TaskPO> selectInReviewWithoutPullRequest();

    List<TaskPO> selectStaleRunning(@Param("cutoff") LocalDateTime cutoff);

    int countByRepoId(@Param("repoId") String repoId);

    int claim(@Param("id") String id, @Param("now") LocalDateTime now);

    int heartbeat(@Param("id") String id, @Param("now") LocalDateTime now);

    int transition(@Param("id") String id,
                   @Param("fromStatus") String fromStatus,
                   @Param("toStatus") String toStatus,
                   @Param("now") LocalDateTime now);

    int fail(@Param("id") String id,
             @Param("fromStatus") String fromStatus,
             @Param("reason") String reason,
             @Param("now") LocalDateTime now);

    int retryFromReview(@Param("id") String id,
                        @Param("reason") String reason,
                        @Param("category") String category,
                        @Param("consecutiveFailures") int consecutiveFailures,
                        @Param("now") LocalDateTime now);

    int retryFromRunning(@Param("id") String id,
                         @Param("reason") String reason,
                         @Param("consecutiveFailures") int consecutiveFailures,
                         @Param("now") LocalDateTime now);

    int requeueStale(@Param("id") String id,
                     @Param("reason") String reason,
                     @Param("cutoff") LocalDateTime cutoff,
                     @Param("now") LocalDateTime now);

    int manualRetry(@Param("id") String id,
                    @Param("instructions") String instructions,
                    @Param("now") LocalDateTime now);

    int feedbackRetry(@Param("id") String id,
                      @Param("feedback") String feedback,
                      @Param("now") LocalDateTime now);

    int startOver(@Param("id") String id,
                  @Param("title") String title,
                  @Param("description") String description,
                  @Param("acceptanceCriteria") String acceptanceCriteria,
                  @Param("now") LocalDateTime now);

    int updatePending(@Param("id") String id,
                      @Param("title") String title,
                      @Param("description") String description,
                      @Param("acceptanceCriteria") String acceptanceCriteria,
                      @Param("dependsOn") String dependsOn,
                      @Param("maxAttempts") Integer maxAttempts,
                      @Param("maxCostUsd") BigDecimal maxCostUsd,
                      @Param("skipPr") Boolean skipPr,
                      @Param("model") String model,
                      @Param("ready") Boolean ready,
                      @Param("now") LocalDateTime now);

    int close(@Param("id") String id, @Param("reason") String reason, @Param("now") LocalDateTime now);

    int setPullRequest(@Param("id") String id,
                       @Param("pullRequestUrl") String pullRequestUrl,
                       @Param("prNumber") int prNumber,
                       @Param("now") LocalDateTime now);

    int setBranch(@Param("id") String id, @Param("branchName") String branchName, @Param("now") LocalDateTime now);

    int setAgentStatus(@Param("id") String id, @Param("agentStatus") String agentStatus, @Param("now") LocalDateTime now);

    int setRetryContext(@Param("id") String id, @Param("retryContext") String retryContext, @Param("now") LocalDateTime now);

    int addCost(@Param("id") String id, @Param("costUsd") BigDecimal costUsd, @Param("now") LocalDateTime now);

    int setCloseReason(@Param("id") String id, @Param("reason") String reason, @Param("now") LocalDateTime now);

    int setReady(@Param("id") String id, @Param("ready") boolean ready, @Param("now") LocalDateTime now);

    int removeDependency(@Param("id") String id,
                         @Param("dependencyId") String dependencyId,
                         @Param("now") LocalDateTime now);
}
