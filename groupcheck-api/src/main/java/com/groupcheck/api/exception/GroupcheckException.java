package com.groupcheck.api.exception;

/**
 * groupcheck 异常基类
 * <p>
 * 所有异常均为非受检异常，由各层自行决定是中止启动、拒绝单个请求还是折叠为拒绝决策。
 *
 * @author groupcheck
 */
public class GroupcheckException extends RuntimeException {

    public GroupcheckException(String message) {
        super(message);
    }

    public GroupcheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
