package com.groupcheck.core.policy;

import java.util.List;

/**
 * 一条策略规则：动作 ID → 允许的组名列表（保持文件中的顺序）
 *
 * @param actionId      动作 ID，区分大小写
 * @param allowedGroups 允许的组名
 * @param source        规则来源，形如 "groupcheck.policy:12"，仅用于诊断
 */
public record PolicyRule(String actionId, List<String> allowedGroups, String source) {

    public PolicyRule {
        allowedGroups = List.copyOf(allowedGroups);
    }

    public PolicyRule(String actionId, List<String> allowedGroups) {
        this(actionId, allowedGroups, "<memory>");
    }
}
