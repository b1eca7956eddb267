package com.verve.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Epic 反馈类型：规划会话消息、确认、关闭。
 */
public enum EpicFeedbackTypeEnum {

    MESSAGE("message"),
    CONFIRMED("confirmed"),
    CLOSED("closed");

    private final String code;

    EpicFeedbackTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EpicFeedbackTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EpicFeedbackTypeEnum value : EpicFeedbackTypeEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown EpicFeedbackTypeEnum code: " + code);
    }
}
