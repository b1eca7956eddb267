package com.verve.domain.review.model.valobj;

import com.verve.types.enums.CheckStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * PR 头提交的组合检查结果。
 */
@Getter
@AllArgsConstructor
public class CheckResult {

    private final CheckStatusEnum status;
    private final String summary;
    private final List<String> failedNames;

    public static CheckResult of(CheckStatusEnum status) {
        return new CheckResult(status, null, Collections.emptyList());
    }
}
