package com.groupcheck.api.security;

import java.util.Map;

/**
 * 授权判定结果，对应线路上的 (bba{ss})
 *
 * @param allowed   是否允许
 * @param challenge 是否需要交互认证，本实现恒为 false
 * @param details   附加信息，恒为空
 */
public record AuthorizationResult(boolean allowed, boolean challenge, Map<String, String> details) {

    private static final AuthorizationResult ALLOW = new AuthorizationResult(true, false, Map.of());
    private static final AuthorizationResult DENY = new AuthorizationResult(false, false, Map.of());

    public AuthorizationResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuthorizationResult allow() {
        return ALLOW;
    }

    public static AuthorizationResult deny() {
        return DENY;
    }
}
