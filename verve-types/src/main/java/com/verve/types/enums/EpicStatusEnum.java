package com.verve.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Epic 状态枚举
 *
 * @author verve
 * @since 2025-06-02
 */
public enum EpicStatusEnum {

    /**
     * 草稿 - 已有拟定任务，等待确认
     */
    DRAFT("draft"),

    /**
     * 规划中 - 等待或正在由规划 worker 处理
     */
    PLANNING("planning"),

    /**
     * 就绪 - 任务已创建但尚未放行
     */
    READY("ready"),

    /**
     * 执行中 - 子任务已放行
     */
    ACTIVE("active"),

    /**
     * 已完成 - 所有子任务已合并或关闭
     */
    COMPLETED("completed"),

    /**
     * 已关闭
     */
    CLOSED("closed");

    private final String code;

    EpicStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EpicStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EpicStatusEnum status : EpicStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown epic status code: " + code);
    }
}
