package com.groupcheck.api.exception;

/**
 * 总线连接、对象导出或名称注册失败
 */
public class TransportException extends GroupcheckException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
