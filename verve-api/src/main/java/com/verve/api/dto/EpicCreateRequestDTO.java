package com.verve.api.dto;

import lombok.Data;

/**
 * 创建 Epic 请求 DTO
 */
@Data
public class EpicCreateRequestDTO {

    private String title;
    private String description;
    private String planningPrompt;
    private String model;
}
