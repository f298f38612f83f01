package com.groupcheck.api.exception;

/**
 * 策略加载异常
 * <p>
 * 策略文件格式错误、无法读取或存在歧义时抛出。整个加载失败，服务拒绝启动。
 */
public class PolicyConfigException extends GroupcheckException {

    private final String source;
    private final int lineNumber;

    public PolicyConfigException(String source, String message) {
        super(message + " (" + source + ")");
        this.source = source;
        this.lineNumber = -1;
    }

    public PolicyConfigException(String source, int lineNumber, String message) {
        super(String.format("%s (%s:%d)", message, source, lineNumber));
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public PolicyConfigException(String source, String message, Throwable cause) {
        super(message + " (" + source + ")", cause);
        this.source = source;
        this.lineNumber = -1;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return 出错行号（从 1 开始），与具体行无关时为 -1
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
