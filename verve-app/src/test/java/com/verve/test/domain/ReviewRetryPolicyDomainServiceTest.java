package com.verve.test.domain;

import com.verve.domain.review.model.valobj.CheckResult;
import com.verve.domain.review.service.ReviewRetryPolicyDomainService;
import com.verve.types.enums.CheckStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

public class ReviewRetryPolicyDomainServiceTest {

    private final ReviewRetryPolicyDomainService service = new ReviewRetryPolicyDomainService();

    @Test
    public void shouldSortFailedCheckNamesIntoCategory() {
        CheckResult result = new CheckResult(CheckStatusEnum.FAILURE, null, Arrays.asList("test", "", "lint"));

        Assertions.assertEquals("ci_failure:lint,test", service.ciFailureCategory(result));
        Assertions.assertEquals("ci_failure: test, , lint", service.ciFailureReason(result));
    }

    @Test
    public void shouldFallBackToGenericCategory() {
        CheckResult result = new CheckResult(CheckStatusEnum.FAILURE, null, Collections.emptyList());

        Assertions.assertEquals("ci_failure", service.ciFailureCategory(result));
        Assertions.assertEquals("ci_failure: checks failed", service.ciFailureReason(result));
    }

    @Test
    public void shouldUseSummaryInReason() {
        CheckResult result = new CheckResult(CheckStatusEnum.FAILURE, " 2 checks failed ", Collections.singletonList("lint"));

        Assertions.assertEquals("ci_failure: 2 checks failed", service.ciFailureReason(result));
    }
}
