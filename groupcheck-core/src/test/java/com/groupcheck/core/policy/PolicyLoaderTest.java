package com.groupcheck.core.policy;

import com.groupcheck.api.exception.PolicyConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolicyLoader 单元测试")
class PolicyLoaderTest {

    @TempDir
    Path tempDir;

    private PolicyLoader loader;

    @BeforeEach
    void setUp() {
        loader = new PolicyLoader();
    }

    private PolicyStore load(String content) {
        return loader.load("test.policy", new StringReader(content));
    }

    private static List<String> ids(PolicyStore store) {
        return store.rules().stream().map(PolicyRule::actionId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("合法输入")
    class ValidInputTests {

        @Test
        @DisplayName("加载后按动作 ID 查到的组应保持文件顺序")
        void shouldRoundTripGroupsInOrder() {
            PolicyStore store = load("a.b.c=\"g1,g2\"\n");

            PolicyRule rule = store.lookup("a.b.c").orElseThrow();
            assertEquals(List.of("g1", "g2"), rule.allowedGroups());
        }

        @Test
        @DisplayName("应忽略注释与空行")
        void shouldSkipCommentsAndBlankLines() {
            PolicyStore store = load("# reboot allowed only for adm\n\n   \norg.example.reboot=\"adm\"\n#x=\"y\"\n");

            assertEquals(1, store.size());
            assertTrue(store.lookup("org.example.reboot").isPresent());
        }

        @Test
        @DisplayName("应保留规则的文件顺序")
        void shouldKeepFileOrder() {
            PolicyStore store = load("C=\"g\"\nA=\"g\"\nB=\"g\"\n");

            assertEquals(List.of("C", "A", "B"), ids(store));
        }

        @Test
        @DisplayName("恰好达到最大组数时应成功")
        void shouldAcceptMaxGroups() {
            PolicyStore store = load("x=\"g1,g2,g3,g4,g5,g6,g7,g8,g9,g10\"\n");

            assertEquals(PolicyLoader.MAX_GROUPS_PER_RULE, store.lookup("x").orElseThrow().allowedGroups().size());
        }

        @Test
        @DisplayName("应容忍行尾空白与 CRLF")
        void shouldTolerateTrailingWhitespace() {
            PolicyStore store = load("x=\"adm\"  \r\ny=\"wheel\"\r\n");

            assertEquals(List.of("adm"), store.lookup("x").orElseThrow().allowedGroups());
            assertEquals(List.of("wheel"), store.lookup("y").orElseThrow().allowedGroups());
        }

        @Test
        @DisplayName("规则应记录来源行号")
        void shouldRecordSource() {
            PolicyStore store = load("# header\nx=\"adm\"\n");

            assertEquals("test.policy:2", store.lookup("x").orElseThrow().source());
        }
    }

    @Nested
    @DisplayName("非法输入导致整体失败")
    class InvalidInputTests {

        @Test
        @DisplayName("缺少 '='")
        void shouldRejectMissingEquals() {
            PolicyConfigException e = assertThrows(PolicyConfigException.class,
                    () -> load("good=\"adm\"\nbad \"adm\"\n"));
            assertEquals(2, e.getLineNumber());
            assertEquals("test.policy", e.getSource());
        }

        @Test
        @DisplayName("缺少右引号")
        void shouldRejectMissingClosingQuote() {
            assertThrows(PolicyConfigException.class, () -> load("x=\"adm,wheel\n"));
        }

        @Test
        @DisplayName("缺少左引号")
        void shouldRejectMissingOpeningQuote() {
            assertThrows(PolicyConfigException.class, () -> load("x=adm\"\n"));
        }

        @Test
        @DisplayName("超过最大组数")
        void shouldRejectTooManyGroups() {
            assertThrows(PolicyConfigException.class,
                    () -> load("x=\"g1,g2,g3,g4,g5,g6,g7,g8,g9,g10,g11\"\n"));
        }

        @Test
        @DisplayName("多个 '='")
        void shouldRejectSecondEquals() {
            assertThrows(PolicyConfigException.class, () -> load("x=\"a=b\"\n"));
        }

        @Test
        @DisplayName("空动作 ID")
        void shouldRejectEmptyActionId() {
            assertThrows(PolicyConfigException.class, () -> load("=\"adm\"\n"));
        }

        @Test
        @DisplayName("空组名")
        void shouldRejectEmptyGroup() {
            assertThrows(PolicyConfigException.class, () -> load("x=\"\"\n"));
            assertThrows(PolicyConfigException.class, () -> load("x=\"adm,\"\n"));
            assertThrows(PolicyConfigException.class, () -> load("x=\"adm,,wheel\"\n"));
        }

        @Test
        @DisplayName("右引号之后还有内容")
        void shouldRejectTrailingContent() {
            assertThrows(PolicyConfigException.class, () -> load("x=\"adm\" extra\n"));
        }

        @Test
        @DisplayName("目录中任一文件出错，其他文件的规则也不保留")
        void shouldNotKeepPartialDirectoryLoad() throws IOException {
            Path dir = Files.createDirectories(tempDir.resolve("policy.d"));
            Files.writeString(dir.resolve("10-good.policy"), "good=\"adm\"\n");
            Files.writeString(dir.resolve("20-bad.policy"), "bad\n");

            assertThrows(PolicyConfigException.class, () -> loader.loadPath(dir));
        }
    }

    @Nested
    @DisplayName("重复动作 ID")
    class DuplicateTests {

        @Test
        @DisplayName("默认先出现的规则生效")
        void shouldKeepFirstByDefault() {
            PolicyStore store = load("x=\"adm,wheel\"\nx=\"adm\"\n");

            assertEquals(1, store.size());
            assertEquals(List.of("adm", "wheel"), store.lookup("x").orElseThrow().allowedGroups());
        }

        @Test
        @DisplayName("严格模式下视为配置错误")
        void shouldRejectInStrictMode() {
            PolicyLoader strict = new PolicyLoader(true);

            assertThrows(PolicyConfigException.class,
                    () -> strict.load("test.policy", new StringReader("x=\"adm\"\nx=\"wheel\"\n")));
        }
    }

    @Nested
    @DisplayName("文件与目录")
    class PathTests {

        @Test
        @DisplayName("应加载单个文件")
        void shouldLoadFile() throws IOException {
            Path file = tempDir.resolve("groupcheck.policy");
            Files.writeString(file, "org.example.a=\"adm\"\n");

            assertEquals(1, loader.loadPath(file).size());
        }

        @Test
        @DisplayName("目录按文件名顺序加载 *.policy，忽略其他文件")
        void shouldLoadDirectoryInNameOrder() throws IOException {
            Path dir = Files.createDirectories(tempDir.resolve("policy.d"));
            Files.writeString(dir.resolve("20-second.policy"), "B=\"wheel\"\n");
            Files.writeString(dir.resolve("10-first.policy"), "A=\"adm\"\n");
            Files.writeString(dir.resolve("README"), "not a policy\n");
            Files.writeString(dir.resolve(".hidden.policy"), "broken\n");

            assertEquals(List.of("A", "B"), ids(loader.loadPath(dir)));
        }

        @Test
        @DisplayName("空目录应失败")
        void shouldRejectEmptyDirectory() throws IOException {
            Path dir = Files.createDirectories(tempDir.resolve("empty.d"));

            assertThrows(PolicyConfigException.class, () -> loader.loadPath(dir));
        }

        @Test
        @DisplayName("不存在的路径应失败")
        void shouldRejectMissingPath() {
            assertThrows(PolicyConfigException.class, () -> loader.loadPath(tempDir.resolve("nope")));
        }

        @Test
        @DisplayName("locate 返回第一个存在的候选")
        void shouldLocateFirstExisting() throws IOException {
            Path second = tempDir.resolve("second.policy");
            Files.writeString(second, "");

            assertEquals(second, PolicyLoader.locate(List.of(tempDir.resolve("first.policy").toString(),
                    second.toString())).orElseThrow());
            assertTrue(PolicyLoader.locate(List.of(tempDir.resolve("none").toString())).isEmpty());
        }
    }
}
