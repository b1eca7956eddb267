package com.verve.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Epic 反馈长轮询结果，无反馈时 type 为 timeout。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EpicFeedbackDTO {

    private String type;
    private String feedback;
}
