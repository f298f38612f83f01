package com.groupcheck.core.service;

import com.groupcheck.api.exception.PolicyConfigException;
import com.groupcheck.core.audit.DecisionAuditor;
import com.groupcheck.core.config.GroupcheckConfig;
import com.groupcheck.core.decision.DecisionEngine;
import com.groupcheck.core.os.EtcGroupDatabase;
import com.groupcheck.core.os.ProcFsProcessTable;
import com.groupcheck.core.os.ProcStatusCredentialSource;
import com.groupcheck.core.policy.PolicyLoader;
import com.groupcheck.core.policy.PolicyStore;
import com.groupcheck.core.spi.BusPeerCredentialSource;
import com.groupcheck.core.subject.SubjectResolver;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 按配置组装 {@link DefaultAuthorityService}
 * 策略在此一次性加载，失败即抛出，服务不会带着残缺策略启动。
 */
@Slf4j
public final class AuthorityServiceFactory {

    private AuthorityServiceFactory() {
    }

    /**
     * 定位并加载策略
     *
     * @throws PolicyConfigException 找不到策略或策略无效
     */
    public static PolicyStore loadPolicy(GroupcheckConfig config) {
        Path policyPath = PolicyLoader.locate(config.getPolicyPaths())
                .orElseThrow(() -> new PolicyConfigException(String.valueOf(config.getPolicyPaths()),
                        "No policy file found"));
        log.info("[Policy] Loading policy from {}", policyPath);
        return new PolicyLoader(config.isStrictDuplicates()).loadPath(policyPath);
    }

    /**
     * @param busPeerCredentials 传输层提供的对端凭证查询
     */
    public static DefaultAuthorityService create(GroupcheckConfig config, PolicyStore store,
                                                 BusPeerCredentialSource busPeerCredentials) {
        Path procRoot = Path.of(config.getProcRoot());
        SubjectResolver resolver = new SubjectResolver(
                new ProcStatusCredentialSource(procRoot),
                new ProcFsProcessTable(procRoot),
                busPeerCredentials);
        List<Path> groupFiles = config.getGroupFiles().stream().map(Path::of).collect(Collectors.toList());
        DecisionEngine engine = new DecisionEngine(new EtcGroupDatabase(groupFiles));
        return new DefaultAuthorityService(store, resolver, engine, new DecisionAuditor(), config.getBackendVersion());
    }
}
