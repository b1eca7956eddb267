package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * SSE 连接建立时的 init 快照
 */
@Data
public class StreamSnapshotDTO {

    private List<TaskDTO> tasks;
    private List<EpicDTO> epics;
}
