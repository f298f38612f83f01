package com.groupcheck.core.service;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.api.exception.PolicyConfigException;
import com.groupcheck.core.config.GroupcheckConfig;
import com.groupcheck.core.os.ProcFixture;
import com.groupcheck.core.policy.PolicyStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuthorityServiceFactory 测试")
class AuthorityServiceFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("取第一个存在的策略路径")
    void shouldLoadFirstExistingPolicy() throws IOException {
        Path second = tempDir.resolve("second.policy");
        Files.writeString(second, "org.example.reboot=\"adm\"\n");
        Path third = tempDir.resolve("third.policy");
        Files.writeString(third, "org.example.other=\"adm\"\n");

        GroupcheckConfig config = GroupcheckConfig.builder()
                .policyPaths(List.of(tempDir.resolve("first.policy").toString(), second.toString(), third.toString()))
                .build();

        PolicyStore store = AuthorityServiceFactory.loadPolicy(config);

        assertEquals(1, store.size());
        assertTrue(store.lookup("org.example.reboot").isPresent());
    }

    @Test
    @DisplayName("所有候选路径都不存在时失败")
    void shouldFailWithoutPolicy() {
        GroupcheckConfig config = GroupcheckConfig.builder()
                .policyPaths(List.of(tempDir.resolve("none.policy").toString()))
                .build();

        PolicyConfigException e = assertThrows(PolicyConfigException.class,
                () -> AuthorityServiceFactory.loadPolicy(config));
        assertTrue(e.getMessage().contains("No policy file found"));
    }

    @Test
    @DisplayName("严格模式下重复 ID 失败")
    void strictDuplicatesShouldPropagate() throws IOException {
        Path policy = tempDir.resolve("dup.policy");
        Files.writeString(policy, "a=\"adm\"\na=\"wheel\"\n");
        GroupcheckConfig config = GroupcheckConfig.builder()
                .policyPaths(List.of(policy.toString()))
                .strictDuplicates(true)
                .build();

        assertThrows(PolicyConfigException.class, () -> AuthorityServiceFactory.loadPolicy(config));
    }

    @Test
    @DisplayName("按配置的 procRoot 与组文件组装服务")
    void shouldWireConfiguredRoots() throws IOException {
        ProcFixture fixture = new ProcFixture(tempDir)
                .group("adm", 4)
                .process(100, "bash", 55, 1000, 1000, 1000, List.of(4L));
        Path policy = tempDir.resolve("groupcheck.policy");
        Files.writeString(policy, "org.example.reboot=\"adm\"\n");

        GroupcheckConfig config = GroupcheckConfig.builder()
                .policyPaths(List.of(policy.toString()))
                .procRoot(fixture.procRoot().toString())
                .groupFiles(List.of(tempDir.resolve("no-such-group").toString(), fixture.groupFile().toString()))
                .backendVersion("9.9")
                .build();

        DefaultAuthorityService service = AuthorityServiceFactory.create(config,
                AuthorityServiceFactory.loadPolicy(config),
                busName -> {
                    throw new CredentialException("no bus in tests");
                });

        assertEquals("9.9", service.getBackendVersion());
        assertTrue(service.checkAuthorization("unix-process", Map.of("pid", 100L, "start-time", 55L),
                "org.example.reboot", Map.of(), 0L, "").allowed());
        assertFalse(service.checkAuthorization("system-bus-name", Map.of("name", ":1.9"),
                "org.example.reboot", Map.of(), 0L, "").allowed());
    }
}
