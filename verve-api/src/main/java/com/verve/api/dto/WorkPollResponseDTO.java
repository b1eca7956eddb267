package com.verve.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Worker 长轮询领取结果
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkPollResponseDTO {

    /**
     * epic 或 task
     */
    private String type;
    private TaskDTO task;
    private EpicDTO epic;
    private String repoFullName;
    private String codeHostToken;
}
