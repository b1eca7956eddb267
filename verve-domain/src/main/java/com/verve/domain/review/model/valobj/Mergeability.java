package com.verve.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * PR 可合并状态，mergeable 为 null 表示平台尚未计算。
 */
@Getter
@AllArgsConstructor
public class Mergeability {

    private final Boolean mergeable;
    private final String mergeableState;
    private final boolean conflicting;

    public boolean hasConflicts() {
        return conflicting;
    }
}
