package com.verve.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 代码评审平台组合检查状态。
 */
public enum CheckStatusEnum {

    PENDING("pending"),
    SUCCESS("success"),
    FAILURE("failure");

    private final String code;

    CheckStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static CheckStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CheckStatusEnum value : CheckStatusEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown CheckStatusEnum code: " + code);
    }
}
