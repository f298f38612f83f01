package com.groupcheck.core.policy;

import com.groupcheck.api.exception.PolicyConfigException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 策略加载器
 * <p>
 * 文件格式：每行一条规则，除换行外不允许空白。
 *
 * <pre>
 * # reboot allowed only for adm and wheel
 * org.freedesktop.login1.reboot="adm,wheel"
 * </pre>
 * <p>
 * 以 '#' 开头的行和空行被忽略。任何一行格式错误都会让整个加载失败，
 * 不会得到一个只加载了一部分的策略表。
 */
@Slf4j
public class PolicyLoader {

    /**
     * 每条规则允许的最大组数
     */
    public static final int MAX_GROUPS_PER_RULE = 10;

    /**
     * 目录模式下只读取该后缀的文件
     */
    public static final String POLICY_FILE_SUFFIX = ".policy";

    private final boolean strictDuplicates;

    public PolicyLoader() {
        this(false);
    }

    /**
     * @param strictDuplicates true 时重复的动作 ID 视为配置错误；否则先出现的规则生效
     */
    public PolicyLoader(boolean strictDuplicates) {
        this.strictDuplicates = strictDuplicates;
    }

    /**
     * 返回候选路径中第一个存在的
     */
    public static Optional<Path> locate(List<String> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(Path::of)
                .filter(Files::exists)
                .findFirst();
    }

    /**
     * 加载文件或目录
     */
    public PolicyStore loadPath(Path path) {
        return loadPaths(List.of(path));
    }

    /**
     * 依次加载多个文件或目录，所有来源共享同一张表
     */
    public PolicyStore loadPaths(List<Path> paths) {
        Map<String, PolicyRule> rules = new LinkedHashMap<>();
        for (Path path : paths) {
            for (Path file : expand(path)) {
                try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                    parseInto(rules, file.toString(), reader);
                } catch (IOException e) {
                    throw new PolicyConfigException(file.toString(), "Failed to read policy file", e);
                }
            }
        }
        return finish(rules);
    }

    /**
     * 从单个字符流加载
     *
     * @param sourceName 来源名称，出现在错误信息中
     */
    public PolicyStore load(String sourceName, Reader reader) {
        Map<String, PolicyRule> rules = new LinkedHashMap<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            parseInto(rules, sourceName, br);
        } catch (IOException e) {
            throw new PolicyConfigException(sourceName, "Failed to read policy source", e);
        }
        return finish(rules);
    }

    private PolicyStore finish(Map<String, PolicyRule> rules) {
        PolicyStore store = PolicyStore.of(new ArrayList<>(rules.values()));
        if (store.isEmpty()) {
            log.warn("[Policy] Policy contains no rules, every request will be denied");
        } else {
            log.info("[Policy] Loaded {} rule(s)", store.size());
        }
        return store;
    }

    private List<Path> expand(Path path) {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        if (!Files.isDirectory(path)) {
            throw new PolicyConfigException(path.toString(), "Policy source does not exist");
        }
        List<Path> files;
        try (Stream<Path> children = Files.list(path)) {
            files = children
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(p -> p.getFileName().toString().endsWith(POLICY_FILE_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PolicyConfigException(path.toString(), "Failed to list policy directory", e);
        }
        if (files.isEmpty()) {
            throw new PolicyConfigException(path.toString(), "No *" + POLICY_FILE_SUFFIX + " files in directory");
        }
        log.debug("[Policy] Directory {} expanded to {}", path, files);
        return files;
    }

    private void parseInto(Map<String, PolicyRule> rules, String source, BufferedReader reader) throws IOException {
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            PolicyRule rule = parseLine(line, source, lineNumber);
            PolicyRule existing = rules.putIfAbsent(rule.actionId(), rule);
            if (existing != null) {
                if (strictDuplicates) {
                    throw new PolicyConfigException(source, lineNumber,
                            "Duplicate action id '" + rule.actionId() + "', first defined at " + existing.source());
                }
                log.warn("[Policy] Ignoring duplicate action id '{}' at {}:{}, keeping rule from {}",
                        rule.actionId(), source, lineNumber, existing.source());
            }
        }
    }

    /**
     * 解析一行 {@code action-id="group1,group2"}
     *
     * @throws PolicyConfigException 格式错误
     */
    static PolicyRule parseLine(String rawLine, String source, int lineNumber) {
        String line = rawLine.stripTrailing();

        int equals = line.indexOf('=');
        if (equals < 0) {
            throw new PolicyConfigException(source, lineNumber, "Missing '='");
        }
        if (line.indexOf('=', equals + 1) >= 0) {
            throw new PolicyConfigException(source, lineNumber, "More than one '='");
        }

        String actionId = line.substring(0, equals);
        if (actionId.isEmpty()) {
            throw new PolicyConfigException(source, lineNumber, "Empty action id");
        }

        String value = line.substring(equals + 1);
        if (!value.startsWith("\"")) {
            throw new PolicyConfigException(source, lineNumber, "Group list must start with '\"'");
        }
        if (value.length() < 2 || !value.endsWith("\"")) {
            throw new PolicyConfigException(source, lineNumber, "Missing closing '\"'");
        }

        String body = value.substring(1, value.length() - 1);
        if (body.indexOf('"') >= 0) {
            throw new PolicyConfigException(source, lineNumber, "Unexpected '\"' inside group list");
        }

        // limit -1 保留末尾空串，"a," 这样的行要报错
        List<String> groups = Arrays.asList(body.split(",", -1));
        if (groups.size() > MAX_GROUPS_PER_RULE) {
            throw new PolicyConfigException(source, lineNumber,
                    "Too many groups (" + groups.size() + " > " + MAX_GROUPS_PER_RULE + ")");
        }
        for (String group : groups) {
            if (group.isEmpty()) {
                throw new PolicyConfigException(source, lineNumber, "Empty group name");
            }
        }

        return new PolicyRule(actionId, groups, source + ":" + lineNumber);
    }
}
