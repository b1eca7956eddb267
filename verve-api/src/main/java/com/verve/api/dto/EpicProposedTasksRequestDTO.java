package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 提交候选任务列表请求 DTO，用户编辑与 agent 提案共用。
 */
@Data
public class EpicProposedTasksRequestDTO {

    private List<ProposedTaskDTO> tasks;
}
