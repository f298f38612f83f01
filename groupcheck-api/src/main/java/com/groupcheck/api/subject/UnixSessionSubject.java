package com.groupcheck.api.subject;

/**
 * 会话主体。只解析，不做凭证解析，判定时一律拒绝。
 */
public record UnixSessionSubject(String sessionId) implements Subject {

    @Override
    public String kind() {
        return KIND_UNIX_SESSION;
    }

    @Override
    public String describe() {
        return String.format("Unix session (session id: %s)", sessionId);
    }
}
