package com.groupcheck.core.service;

import com.groupcheck.api.exception.InvalidSubjectException;
import com.groupcheck.api.security.ActionDescription;
import com.groupcheck.api.security.AuthorityService;
import com.groupcheck.api.security.AuthorizationResult;
import com.groupcheck.api.security.Credentials;
import com.groupcheck.api.subject.Subject;
import com.groupcheck.core.audit.DecisionAuditor;
import com.groupcheck.core.decision.DecisionEngine;
import com.groupcheck.core.monitor.TraceContext;
import com.groupcheck.core.policy.PolicyStore;
import com.groupcheck.core.subject.SubjectParser;
import com.groupcheck.core.subject.SubjectResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 默认授权机构实现
 * 职责：解析主体 → 校验凭证 → 判定 → 记录审计日志
 * <p>
 * 所有依赖在构造时传入且不可变，不持有任何跨请求的可变状态。
 */
@Slf4j
public class DefaultAuthorityService implements AuthorityService {

    public static final String BACKEND_NAME = "groupcheck";

    /**
     * 不支持临时授权等任何可选特性
     */
    public static final long BACKEND_FEATURES = 0L;

    private final PolicyStore policyStore;
    private final SubjectResolver subjectResolver;
    private final DecisionEngine decisionEngine;
    private final DecisionAuditor auditor;
    private final String backendVersion;

    public DefaultAuthorityService(PolicyStore policyStore,
                                   SubjectResolver subjectResolver,
                                   DecisionEngine decisionEngine,
                                   DecisionAuditor auditor,
                                   String backendVersion) {
        this.policyStore = policyStore;
        this.subjectResolver = subjectResolver;
        this.decisionEngine = decisionEngine;
        this.auditor = auditor;
        this.backendVersion = backendVersion;
    }

    @Override
    public AuthorizationResult checkAuthorization(String subjectKind, Map<String, Object> subjectDetails,
                                                  String actionId, Map<String, String> details,
                                                  long flags, String cancellationId) {
        TraceContext.start();
        try {
            Subject subject;
            try {
                subject = SubjectParser.parse(subjectKind, subjectDetails);
            } catch (InvalidSubjectException e) {
                auditor.recordRejected(subjectKind, actionId, e.getMessage());
                throw e;
            }
            log.debug("[Auth] CheckAuthorization: subject={}, actionId={}, flags={}", subject, actionId, flags);

            Optional<Credentials> credentials = subjectResolver.resolve(subject);
            AuthorizationResult result = decisionEngine.decide(policyStore, actionId, credentials);

            auditor.record(subject, actionId, result.allowed());
            return result;
        } finally {
            TraceContext.clear();
        }
    }

    @Override
    public void cancelCheckAuthorization(String cancellationId) {
        // 判定是同步完成的，不存在可取消的检查
        log.debug("[Auth] CancelCheckAuthorization({}) ignored", cancellationId);
    }

    @Override
    public List<ActionDescription> enumerateActions(String locale) {
        return policyStore.rules().stream()
                .map(rule -> ActionDescription.bare(rule.actionId()))
                .collect(Collectors.toList());
    }

    @Override
    public String getBackendName() {
        return BACKEND_NAME;
    }

    @Override
    public String getBackendVersion() {
        return backendVersion;
    }

    @Override
    public long getBackendFeatures() {
        return BACKEND_FEATURES;
    }
}
