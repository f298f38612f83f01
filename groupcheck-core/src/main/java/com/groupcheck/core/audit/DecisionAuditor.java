package com.groupcheck.core.audit;

import com.groupcheck.api.subject.Subject;
import lombok.extern.slf4j.Slf4j;

/**
 * 审计记录器
 * 每次授权检查同步写一行审计日志（logger: groupcheck.audit），记录主体、动作与结果。
 * <p>
 * 调用方提供的文本中的控制字符会被转义，一次判定只产生一行。
 */
@Slf4j(topic = "groupcheck.audit")
public class DecisionAuditor {

    public void record(Subject subject, String actionId, boolean allowed) {
        if (subject == null || actionId == null) {
            return;
        }
        log.info("{} {}allowed to do action-id {}", escape(subject.describe()), allowed ? "" : "NOT ", escape(actionId));
    }

    /**
     * 主体描述无法解析的请求
     */
    public void recordRejected(String subjectKind, String actionId, String reason) {
        log.warn("Rejected malformed request (subject kind: {}, action-id: {}): {}",
                escape(subjectKind), escape(actionId), escape(reason));
    }

    /**
     * 转义反斜杠与控制字符：\n \r \t 保持可读，其余写成 \xNN
     */
    static String escape(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = replacementFor(c);
            if (replacement == null) {
                if (sb != null) {
                    sb.append(c);
                }
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(value.length() + 8).append(value, 0, i);
            }
            sb.append(replacement);
        }
        return sb == null ? value : sb.toString();
    }

    private static String replacementFor(char c) {
        switch (c) {
            case '\\':
                return "\\\\";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            default:
                if (Character.isISOControl(c) || Character.getType(c) == Character.LINE_SEPARATOR
                        || Character.getType(c) == Character.PARAGRAPH_SEPARATOR) {
                    return c <= 0xFF ? String.format("\\x%02x", (int) c) : String.format("\\u%04x", (int) c);
                }
                return null;
        }
    }
}
