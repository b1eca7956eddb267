package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 重新开始请求 DTO，空字段保持原值。
 */
@Data
public class TaskStartOverRequestDTO {

    private String title;
    private String description;
    private List<String> acceptanceCriteria;
}
