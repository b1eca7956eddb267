package com.verve.domain.epic.adapter.gateway;

import com.verve.domain.epic.model.valobj.PlannedTask;

import java.util.List;

/**
 * 任务规划网关（LLM 规划服务），失败时抛出 UPSTREAM_UNAVAILABLE。
 */
public interface ITaskPlanner {

    List<PlannedTask> proposeTasks(String epicTitle, String epicDescription, String extraInstructions);
}
