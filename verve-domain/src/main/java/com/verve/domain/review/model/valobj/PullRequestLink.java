package com.verve.domain.review.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 分支对应的 PR。
 */
@Getter
@AllArgsConstructor
public class PullRequestLink {

    private final String url;
    private final int number;
}
