/**
 * Task 领域 - 任务生命周期域
 *
 * <p>职责：任务状态流转、依赖就绪判定、完成结果归类、重试与熔断</p>
 *
 * <h3>状态</h3>
 * <ul>
 *   <li>pending → running → review → merged</li>
 *   <li>任意非终态可转为 closed；重试耗尽或熔断时转为 failed</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.verve.domain.task.model.entity.TaskEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>TaskCompletionDomainService - worker 上报结果的归类</li>
 *   <li>TaskRetryPolicyDomainService - 重试次数、成本上限与连续同因失败熔断</li>
 * </ul>
 *
 * @author verve
 * @since 2025-06-02
 */
package com.verve.domain.task;
