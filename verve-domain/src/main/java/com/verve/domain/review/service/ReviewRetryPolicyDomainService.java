package com.verve.domain.review.service;

import com.verve.domain.review.model.valobj.CheckResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 评审结果驱动的自动重试：生成重试原因与熔断类别。
 * 类别包含排序后的失败检查名，不同检查的失败不会互相触发熔断。
 */
@Service
public class ReviewRetryPolicyDomainService {

    public static final String MERGE_CONFLICT_CATEGORY = "merge_conflict";
    public static final String MERGE_CONFLICT_REASON = "merge_conflict: PR has conflicts with base branch";
    public static final String CI_FAILURE_CATEGORY = "ci_failure";

    public String ciFailureCategory(CheckResult result) {
        List<String> names = result == null || result.getFailedNames() == null
                ? Collections.emptyList() : new ArrayList<>(result.getFailedNames());
        names.removeIf(StringUtils::isBlank);
        if (names.isEmpty()) {
            return CI_FAILURE_CATEGORY;
        }
        Collections.sort(names);
        return CI_FAILURE_CATEGORY + ":" + String.join(",", names);
    }

    public String ciFailureReason(CheckResult result) {
        String summary = result == null ? null : StringUtils.trimToNull(result.getSummary());
        if (summary == null && result != null && result.getFailedNames() != null && !result.getFailedNames().isEmpty()) {
            summary = String.join(", ", result.getFailedNames());
        }
        return CI_FAILURE_CATEGORY + ": " + StringUtils.defaultString(summary, "checks failed");
    }
}
