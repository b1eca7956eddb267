package com.verve.infrastructure.dao;

import com.verve.infrastructure.dao.po.EpicPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Epic DAO
 *
 * @author verve
 * @since 2025-06-02
 */
@Mapper
public interface EpicDao {

    int insert(EpicPO po);

    EpicPO selectById(@Param("id") String id);

    List<EpicPO> selectAll();

    List<EpicPO> selectByRepoId(@Param("repoId") String repoId);

    List<EpicPO> selectByStatus(@Param("status") String status);

    List<EpicPO> selectClaimCandidates();

    List<EpicPO> selectStaleClaimed(@Param("cutoff") LocalDateTime cutoff);

    int claim(@Param("id") String id, @Param("now") LocalDateTime now);

    int heartbeat(@Param("id") String id, @Param("now") LocalDateTime now);

    int releaseClaim(@Param("id") String id, @Param("now") LocalDateTime now);

    int releaseStaleClaim(@Param("id") String id,
                          @Param("cutoff") LocalDateTime cutoff,
                          @Param("now") LocalDateTime now);

    int setFeedback(@Param("id") String id,
                    @Param("feedback") String feedback,
                    @Param("feedbackType") String feedbackType,
                    @Param("status") String status,
                    @Param("now") LocalDateTime now);

    int clearFeedback(@Param("id") String id,
                      @Param("expectedFeedback") String expectedFeedback,
                      @Param("expectedType") String expectedType,
                      @Param("now") LocalDateTime now);

    int updateProposedTasks(@Param("id") String id,
                            @Param("proposedTasks") String proposedTasks,
                            @Param("now") LocalDateTime now);

    int appendSessionLog(@Param("id") String id, @Param("lines") String lines, @Param("now") LocalDateTime now);

    int startPlanning(@Param("id") String id,
                      @Param("planningPrompt") String planningPrompt,
                      @Param("now") LocalDateTime now);

    int confirm(@Param("id") String id,
                @Param("taskIds") String taskIds,
                @Param("status") String status,
                @Param("notReady") boolean notReady,
                @Param("now") LocalDateTime now);

    int close(@Param("id") String id, @Param("now") LocalDateTime now);

    int complete(@Param("id") String id, @Param("now") LocalDateTime now);

    int deleteDraft(@Param("id") String id);
}
