package com.verve.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SSE 推送的领域事件，task/epic 为实体完整当前状态
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEventDTO {

    private String type;
    private String repoId;
    private String taskId;
    private String epicId;
    private TaskDTO task;
    private EpicDTO epic;
    private Integer attempt;
    private List<String> logs;
    private LocalDateTime occurredAt;
}
