package com.verve.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 代码评审平台上的一个 PR 引用。
 */
@Getter
@ToString
@AllArgsConstructor
public class PullRequestRef {

    private final String owner;
    private final String repoName;
    private final int number;
}
