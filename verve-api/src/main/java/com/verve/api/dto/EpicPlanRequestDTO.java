package com.verve.api.dto;

import lombok.Data;

/**
 * 重新规划请求 DTO
 */
@Data
public class EpicPlanRequestDTO {

    private String prompt;
}
