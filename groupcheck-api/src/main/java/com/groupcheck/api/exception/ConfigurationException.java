package com.groupcheck.api.exception;

/**
 * 守护进程配置异常（配置文件无法读取或取值非法）
 */
public class ConfigurationException extends GroupcheckException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
