package com.groupcheck.core.subject;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.api.security.Credentials;
import com.groupcheck.api.subject.Subject;
import com.groupcheck.api.subject.SystemBusNameSubject;
import com.groupcheck.api.subject.UnixProcessSubject;
import com.groupcheck.api.subject.UnixSessionSubject;
import com.groupcheck.core.spi.BusPeerCredentialSource;
import com.groupcheck.core.spi.ProcessCredentialSource;
import com.groupcheck.core.spi.ProcessTable;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 主体凭证解析与防伪校验
 * <p>
 * 校验规则：
 * <ol>
 * <li>进程主体：凭证读取之后，再从进程表独立读取启动时间，必须与请求中的值完全一致（防止 pid 复用冒充）</li>
 * <li>总线名主体：凭证来自总线对端身份查询</li>
 * <li>会话主体：不解析，结果为空</li>
 * <li>所有情况下 real uid 必须等于 effective uid</li>
 * </ol>
 * 任何失败都只表现为空结果，调用方看不到失败原因。
 */
@Slf4j
public class SubjectResolver {

    private final ProcessCredentialSource processCredentials;
    private final ProcessTable processTable;
    private final BusPeerCredentialSource busPeerCredentials;

    public SubjectResolver(ProcessCredentialSource processCredentials,
                           ProcessTable processTable,
                           BusPeerCredentialSource busPeerCredentials) {
        this.processCredentials = processCredentials;
        this.processTable = processTable;
        this.busPeerCredentials = busPeerCredentials;
    }

    /**
     * @return 已校验的凭证；主体无法校验时为空
     */
    public Optional<Credentials> resolve(Subject subject) {
        try {
            Credentials credentials = verify(subject);
            if (!credentials.isUidConsistent()) {
                throw new CredentialException(String.format("uid %d != euid %d",
                        credentials.realUid(), credentials.effectiveUid()));
            }
            return Optional.of(credentials);
        } catch (CredentialException e) {
            log.debug("[Auth] Subject unverifiable: {} -> {}", subject.describe(), e.getMessage());
            return Optional.empty();
        }
    }

    private Credentials verify(Subject subject) throws CredentialException {
        if (subject instanceof UnixProcessSubject process) {
            Credentials credentials = processCredentials.credentialsOf(process.pid());
            long actualStartTime = processTable.startTimeOf(process.pid());
            if (actualStartTime != process.startTime()) {
                throw new CredentialException(String.format("start time mismatch for pid %d: claimed %d, actual %d",
                        process.pid(), process.startTime(), actualStartTime));
            }
            return credentials;
        }
        if (subject instanceof SystemBusNameSubject busName) {
            if (busPeerCredentials == null) {
                throw new CredentialException("No bus peer credential source available");
            }
            return busPeerCredentials.credentialsOf(busName.busName());
        }
        if (subject instanceof UnixSessionSubject) {
            throw new CredentialException("Session subjects are not supported");
        }
        throw new CredentialException("Unsupported subject kind: " + subject.kind());
    }
}
