package com.verve.domain.epic.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 规划会话拟定的任务，依赖通过临时 ID 引用，确认后才会生成真实任务。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposedTask {

    private String tempId;
    private String title;
    private String description;
    @Builder.Default
    private List<String> dependsOnTempIds = new ArrayList<>();
    @Builder.Default
    private List<String> acceptanceCriteria = new ArrayList<>();

    public ProposedTask copy() {
        return new ProposedTask(tempId, title, description,
                dependsOnTempIds == null ? new ArrayList<>() : new ArrayList<>(dependsOnTempIds),
                acceptanceCriteria == null ? new ArrayList<>() : new ArrayList<>(acceptanceCriteria));
    }
}
