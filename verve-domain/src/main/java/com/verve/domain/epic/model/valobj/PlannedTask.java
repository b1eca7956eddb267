package com.verve.domain.epic.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 规划器返回的任务草案，依赖为 1 起始的列表下标。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlannedTask {

    private String title;
    private String description;
    @Builder.Default
    private List<Integer> dependsOn = new ArrayList<>();
    @Builder.Default
    private List<String> acceptanceCriteria = new ArrayList<>();
}
