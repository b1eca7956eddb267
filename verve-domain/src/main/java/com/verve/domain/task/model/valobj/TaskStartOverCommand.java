package com.verve.domain.task.model.valobj;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * start-over 时可替换的任务内容，null 表示沿用原值。
 */
@Getter
@Builder
public class TaskStartOverCommand {

    private final String title;
    private final String description;
    private final List<String> acceptanceCriteria;
}
