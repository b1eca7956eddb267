package com.verve.types.exception;

import com.verve.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载业务异常，包含异常码和异常描述信息。
 * 上层通过异常码区分 NOT_FOUND、CONFLICT、PRECONDITION_FAILED 等语义。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 3902417533841296105L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    public static AppException notFound(String message) {
        return new AppException(ResponseCode.NOT_FOUND, message);
    }

    public static AppException conflict(String message) {
        return new AppException(ResponseCode.CONFLICT, message);
    }

    public static AppException preconditionFailed(String message) {
        return new AppException(ResponseCode.PRECONDITION_FAILED, message);
    }

    public static AppException illegalParameter(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }

    public static AppException timeout(String message, Throwable cause) {
        return new AppException(ResponseCode.TIMEOUT, message, cause);
    }

    public static AppException upstreamUnavailable(String message, Throwable cause) {
        return new AppException(ResponseCode.UPSTREAM_UNAVAILABLE, message, cause);
    }

    /**
     * 判断异常码是否匹配。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.verve.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
