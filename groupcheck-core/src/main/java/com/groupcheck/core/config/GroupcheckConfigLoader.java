package com.groupcheck.core.config;

import com.groupcheck.api.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从 YAML 加载 {@link GroupcheckConfig}
 *
 * <pre>
 * policyPaths:
 *   - /etc/groupcheck.d
 * strictDuplicates: true
 * bus: SYSTEM
 * </pre>
 */
@Slf4j
public class GroupcheckConfigLoader {

    public static GroupcheckConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            GroupcheckConfig config = load(is);
            log.info("Loaded configuration from {}: {}", file, config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + file, e);
        }
    }

    public static GroupcheckConfig load(InputStream inputStream) {
        Yaml yaml = createLoaderYaml();
        try {
            GroupcheckConfig config = yaml.loadAs(inputStream, GroupcheckConfig.class);
            // 空文件
            if (config == null) {
                return GroupcheckConfig.defaults();
            }
            validate(config);
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static Yaml createLoaderYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(GroupcheckConfig.class, loaderOptions));
    }

    private static void validate(GroupcheckConfig config) {
        if (config.getPolicyPaths() == null || config.getPolicyPaths().isEmpty()) {
            throw new ConfigurationException("policyPaths must not be empty");
        }
        if (isBlank(config.getProcRoot())) {
            throw new ConfigurationException("procRoot must not be empty");
        }
        if (config.getGroupFiles() == null || config.getGroupFiles().isEmpty()
                || config.getGroupFiles().stream().anyMatch(GroupcheckConfigLoader::isBlank)) {
            throw new ConfigurationException("groupFiles must be a non-empty list of paths");
        }
        if (isBlank(config.getBackendVersion())) {
            throw new ConfigurationException("backendVersion must not be empty");
        }
        if (config.getBus() == null) {
            throw new ConfigurationException("bus must be SYSTEM or SESSION");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
