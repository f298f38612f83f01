package com.groupcheck.api.exception;

/**
 * 请求中的主体描述无效
 * <p>
 * 属于协议错误：只拒绝当前请求，服务继续处理后续请求。
 */
public class InvalidSubjectException extends GroupcheckException {

    /**
     * 错误原因分类
     */
    public enum Reason {
        /**
         * 未知的主体类型标签
         */
        INVALID_SUBJECT_KIND,
        /**
         * 已知键携带了错误类型的值
         */
        INVALID_DETAIL_TYPE,
        /**
         * 字符串值超出长度限制
         */
        DETAIL_TOO_LONG
    }

    private final Reason reason;
    private final String detailKey;

    public InvalidSubjectException(Reason reason, String detailKey, String message) {
        super(message);
        this.reason = reason;
        this.detailKey = detailKey;
    }

    public static InvalidSubjectException unknownKind(String kind) {
        return new InvalidSubjectException(Reason.INVALID_SUBJECT_KIND, null,
                "Unknown subject kind: " + kind);
    }

    public Reason getReason() {
        return reason;
    }

    public String getDetailKey() {
        return detailKey;
    }
}
