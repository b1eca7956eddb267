/**
 * Epic 领域 - 规划域
 *
 * <p>职责：Epic 规划会话、提案任务维护、确认后批量生成任务、子任务全部结束后自动完成</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.verve.domain.epic.model.entity.EpicEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>EpicPlanningDomainService - 提案校验与临时 ID 解析</li>
 *   <li>EpicCompletionDomainService - 完成判定</li>
 * </ul>
 *
 * @author verve
 * @since 2025-06-02
 */
package com.verve.domain.epic;
