package com.verve.api.dto;

import lombok.Data;

/**
 * 评审反馈重试请求 DTO
 */
@Data
public class TaskFeedbackRequestDTO {

    private String feedback;
}
