package com.verve.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 所有 REST 接口返回 {code, info, data}，code 与 ResponseCode 一致，成功为 "0000"。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author verve
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 4420591338761207458L;

    /** 响应码 */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

}
