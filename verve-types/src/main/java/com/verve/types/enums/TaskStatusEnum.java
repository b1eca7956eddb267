package com.verve.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 *
 * @author verve
 * @since 2025-06-02
 */
public enum TaskStatusEnum {

    /**
     * 待领取 - 等待 worker 领取（需 ready=true）
     */
    PENDING("pending"),

    /**
     * 运行中 - 已被 worker 领取并持续心跳
     */
    RUNNING("running"),

    /**
     * 评审中 - 已产出分支或 PR，等待合并
     */
    REVIEW("review"),

    /**
     * 已合并 - 终态
     */
    MERGED("merged"),

    /**
     * 已关闭 - 终态
     */
    CLOSED("closed"),

    /**
     * 失败 - 预算耗尽或执行失败，可通过 start-over 重新开始
     */
    FAILED("failed");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == MERGED || this == CLOSED;
    }

    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
