package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Epic 拆分出的候选任务
 */
@Data
public class ProposedTaskDTO {

    private String tempId;
    private String title;
    private String description;
    private List<String> dependsOnTempIds;
    private List<String> acceptanceCriteria;
}
