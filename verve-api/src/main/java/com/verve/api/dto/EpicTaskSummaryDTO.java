package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Epic 下属任务摘要
 */
@Data
public class EpicTaskSummaryDTO {

    private String id;
    private String title;
    private String status;
    private Integer attempt;
    private List<String> dependsOn;
    private String pullRequestUrl;
    private Integer prNumber;
    private String closeReason;
}
