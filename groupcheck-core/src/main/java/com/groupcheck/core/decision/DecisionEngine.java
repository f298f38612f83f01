package com.groupcheck.core.decision;

import com.groupcheck.api.security.AuthorizationResult;
import com.groupcheck.api.security.Credentials;
import com.groupcheck.core.policy.PolicyRule;
import com.groupcheck.core.policy.PolicyStore;
import com.groupcheck.core.spi.GroupDatabase;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * 授权判定
 * <p>
 * 只比对附加组，主组不参与匹配。
 * 无规则、无凭证、uid 不一致均直接拒绝。无状态，可并发调用。
 */
@Slf4j
public class DecisionEngine {

    private final GroupDatabase groupDatabase;

    public DecisionEngine(GroupDatabase groupDatabase) {
        this.groupDatabase = groupDatabase;
    }

    public AuthorizationResult decide(PolicyStore policyStore, String actionId, Optional<Credentials> credentials) {
        Optional<PolicyRule> rule = policyStore.lookup(actionId);
        if (rule.isEmpty()) {
            log.debug("[Auth] No policy for action {}", actionId);
            return AuthorizationResult.deny();
        }
        if (credentials.isEmpty()) {
            return AuthorizationResult.deny();
        }

        Credentials creds = credentials.get();
        if (!creds.isUidConsistent()) {
            return AuthorizationResult.deny();
        }

        for (String group : rule.get().allowedGroups()) {
            OptionalLong gid = groupDatabase.gidOf(group);
            if (gid.isEmpty()) {
                log.debug("[Auth] Group '{}' of action {} does not resolve, skipped", group, actionId);
                continue;
            }
            if (creds.hasSupplementaryGroup(gid.getAsLong())) {
                log.debug("[Auth] Matched group '{}' ({}) for action {}", group, gid.getAsLong(), actionId);
                return AuthorizationResult.allow();
            }
        }
        return AuthorizationResult.deny();
    }
}
