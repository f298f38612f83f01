package com.groupcheck.core.policy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 策略表 (只读)
 * <p>
 * 在服务开始接收请求前构建完毕，之后不再修改，可被多个请求无锁并发读取。
 * 迭代顺序即规则的加载顺序。
 */
public final class PolicyStore {

    private final Map<String, PolicyRule> rules;

    private PolicyStore(Map<String, PolicyRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    /**
     * 由已去重的规则列表构建
     *
     * @throws IllegalArgumentException 列表中存在重复的动作 ID
     */
    public static PolicyStore of(List<PolicyRule> rules) {
        Map<String, PolicyRule> index = new LinkedHashMap<>();
        for (PolicyRule rule : rules) {
            if (index.putIfAbsent(rule.actionId(), rule) != null) {
                throw new IllegalArgumentException("Duplicate action id: " + rule.actionId());
            }
        }
        return new PolicyStore(index);
    }

    /**
     * 精确匹配（区分大小写）
     */
    public Optional<PolicyRule> lookup(String actionId) {
        if (actionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(actionId));
    }

    public Collection<PolicyRule> rules() {
        return rules.values();
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "PolicyStore{rules=" + rules.keySet() + "}";
    }
}
