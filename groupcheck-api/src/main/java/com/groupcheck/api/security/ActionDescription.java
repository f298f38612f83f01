package com.groupcheck.api.security;

import java.util.Map;

/**
 * 动作描述，对应线路上的 (ssssssuuua{ss})
 * <p>
 * 本实现只报告动作 ID，其余元数据为空，且对所有调用方都要求认证。
 *
 * @author groupcheck
 */
public record ActionDescription(
        String actionId,
        String description,
        String message,
        String vendorName,
        String vendorUrl,
        String iconName,
        int implicitAny,
        int implicitInactive,
        int implicitActive,
        Map<String, String> annotations) {

    /**
     * 隐式授权：需要认证
     */
    public static final int AUTHENTICATION_REQUIRED = 1;

    public ActionDescription {
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    /**
     * 只带动作 ID 的描述
     */
    public static ActionDescription bare(String actionId) {
        return new ActionDescription(actionId, "", "", "", "", "",
                AUTHENTICATION_REQUIRED, AUTHENTICATION_REQUIRED, AUTHENTICATION_REQUIRED, Map.of());
    }
}
