package com.groupcheck.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 守护进程配置
 * <p>
 * 可由 YAML 文件加载（见 {@link GroupcheckConfigLoader}），未出现的键保持默认值。
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupcheckConfig {

    public static final String DEFAULT_POLICY_FILE = "/etc/groupcheck.policy";
    public static final String FALLBACK_POLICY_FILE = "/usr/share/defaults/etc/groupcheck.policy";

    /**
     * 总线类型
     */
    public enum BusType {
        SYSTEM,
        SESSION
    }

    /**
     * 策略文件或目录的候选路径，按顺序取第一个存在的
     */
    @Builder.Default
    private List<String> policyPaths = new ArrayList<>(List.of(DEFAULT_POLICY_FILE, FALLBACK_POLICY_FILE));

    /**
     * 重复的动作 ID 是否视为配置错误（否则先出现的生效）
     */
    @Builder.Default
    private boolean strictDuplicates = false;

    @Builder.Default
    private String procRoot = "/proc";

    /**
     * 组数据库文件，按顺序查找
     */
    @Builder.Default
    private List<String> groupFiles = new ArrayList<>(List.of("/etc/group", "/usr/share/defaults/etc/group"));

    /**
     * BackendVersion 属性的值
     */
    @Builder.Default
    private String backendVersion = "0.1";

    @Builder.Default
    private BusType bus = BusType.SYSTEM;

    /**
     * 默认配置
     */
    public static GroupcheckConfig defaults() {
        return GroupcheckConfig.builder().build();
    }

    @Override
    public String toString() {
        return String.format("GroupcheckConfig{policyPaths=%s, strictDuplicates=%s, procRoot=%s, groupFiles=%s, backendVersion=%s, bus=%s}",
                policyPaths, strictDuplicates, procRoot, groupFiles, backendVersion, bus);
    }
}
