package com.verve.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 业务异常码同时决定 HTTP 状态码，映射见 GlobalApiExceptionHandler。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在 */
    NOT_FOUND("0404", "资源不存在"),

    /** 唯一约束冲突 */
    CONFLICT("0409", "资源冲突"),

    /** 条件更新失败，状态已被其他参与方修改 */
    PRECONDITION_FAILED("0412", "状态前置条件不满足"),

    /** 外部平台不可用 */
    UPSTREAM_UNAVAILABLE("0502", "外部服务不可用"),

    /** 存储操作超时 */
    TIMEOUT("0504", "操作超时");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

    public static ResponseCode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ResponseCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return null;
    }

}
