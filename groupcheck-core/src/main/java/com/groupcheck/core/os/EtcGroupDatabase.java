package com.groupcheck.core.os;

import com.groupcheck.core.spi.GroupDatabase;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * 读取 group(5) 格式文件的组数据库：{@code name:password:gid:members}
 * <p>
 * 按顺序查找多个文件（如 /etc/group 与 nss-altfiles 的 /usr/share/defaults/etc/group），
 * 第一个含有该组名的文件生效。不经过 NSS，LDAP/sssd 等来源的组解析不到。
 * <p>
 * 文件按字节读取（ISO-8859-1），单个非 UTF-8 条目不影响其他组。
 * 每次查询都重新读文件，管理员修改组后无需重启。
 */
@Slf4j
public class EtcGroupDatabase implements GroupDatabase {

    private final List<Path> groupFiles;

    public EtcGroupDatabase(Path groupFile) {
        this(List.of(groupFile));
    }

    public EtcGroupDatabase(List<Path> groupFiles) {
        this.groupFiles = List.copyOf(groupFiles);
    }

    @Override
    public OptionalLong gidOf(String groupName) {
        if (groupName == null || groupName.isEmpty()) {
            return OptionalLong.empty();
        }
        // 与文件内容保持同一种按字节的解码
        String rawName = new String(groupName.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
        for (Path groupFile : groupFiles) {
            OptionalLong gid = lookup(groupFile, rawName);
            if (gid.isPresent()) {
                return gid;
            }
        }
        return OptionalLong.empty();
    }

    private OptionalLong lookup(Path groupFile, String rawName) {
        try (BufferedReader reader = Files.newBufferedReader(groupFile, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] fields = line.split(":", -1);
                if (fields.length < 3 || !fields[0].equals(rawName)) {
                    continue;
                }
                try {
                    return OptionalLong.of(Long.parseLong(fields[2].strip()));
                } catch (NumberFormatException e) {
                    log.warn("[Group] Malformed gid for group '{}' in {}", rawName, groupFile);
                    return OptionalLong.empty();
                }
            }
        } catch (NoSuchFileException e) {
            log.debug("[Group] Group database {} not present", groupFile);
        } catch (IOException e) {
            log.warn("[Group] Cannot read group database {}: {}", groupFile, e.getMessage());
        }
        return OptionalLong.empty();
    }
}
