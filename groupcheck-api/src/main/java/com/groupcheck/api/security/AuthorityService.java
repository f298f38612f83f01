package com.groupcheck.api.security;

import com.groupcheck.api.exception.InvalidSubjectException;

import java.util.List;
import java.util.Map;

/**
 * Core 提供 - 授权机构服务
 * 协议层只依赖此接口；三个方法与三个只读属性一一对应总线上的同名成员。
 *
 * @author groupcheck
 */
public interface AuthorityService {

    /**
     * 判定主体能否执行某个动作。同步完成，返回前判定已全部结束。
     *
     * @param subjectKind    主体类型标签，如 "unix-process"
     * @param subjectDetails 主体详情，值已从线路格式解包为普通 Java 对象
     * @param actionId       动作 ID
     * @param details        请求附加信息（不参与判定）
     * @param flags          授权标志（不支持交互，忽略）
     * @param cancellationId 取消 ID（同步模型下无意义）
     * @return 判定结果，凭证错误一律表现为拒绝
     * @throws InvalidSubjectException 主体描述无效时，仅影响本次请求
     */
    AuthorizationResult checkAuthorization(String subjectKind, Map<String, Object> subjectDetails,
                                           String actionId, Map<String, String> details,
                                           long flags, String cancellationId);

    /**
     * 取消进行中的检查。同步模型下不存在进行中的检查，总是成功。
     */
    void cancelCheckAuthorization(String cancellationId);

    /**
     * 按策略文件顺序列出所有动作
     *
     * @param locale 语言环境（不支持本地化，忽略）
     */
    List<ActionDescription> enumerateActions(String locale);

    String getBackendName();

    String getBackendVersion();

    /**
     * 特性位掩码，0 表示不支持临时授权
     */
    long getBackendFeatures();
}
