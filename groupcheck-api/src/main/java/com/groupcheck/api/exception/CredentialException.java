package com.groupcheck.api.exception;

/**
 * 主体凭证无法解析或校验失败
 * <p>
 * 只在解析层内部流转，最终一律折叠为拒绝决策，绝不透出给调用方。
 */
public class CredentialException extends GroupcheckException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
