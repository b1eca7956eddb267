package com.verve.types.common;

/**
 * 全局常量定义类。
 *
 * @author verve
 * @since 2025-06-02
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 未配置 default_model 时使用的模型 */
    public final static String FALLBACK_MODEL = "sonnet";

    /** 任务默认最大尝试次数 */
    public final static int DEFAULT_MAX_ATTEMPTS = 5;

    /** 设置项：默认模型 */
    public final static String SETTING_DEFAULT_MODEL = "default_model";

    /** 设置项：代码托管平台令牌（密文） */
    public final static String SETTING_CODE_HOST_TOKEN = "code_host_token";

    /** Epic 标题最大长度 */
    public final static int EPIC_TITLE_MAX_LENGTH = 200;

    /** Epic 过期会话写入的日志 */
    public final static String EPIC_TIMEOUT_LOG_LINE = "system: Planning session timed out due to inactivity.";

}
