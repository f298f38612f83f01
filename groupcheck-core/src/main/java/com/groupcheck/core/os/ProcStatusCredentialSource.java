package com.groupcheck.core.os;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.api.security.Credentials;
import com.groupcheck.core.spi.ProcessCredentialSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 /proc/[pid]/status 读取凭证
 * <p>
 * 用到的三行：
 * <pre>
 * Uid:    1000    1000    1000    1000     (real effective saved fs)
 * Gid:    1000    1000    1000    1000
 * Groups: 4 27 1000
 * </pre>
 * 主组取 Gid 行的 real gid。Name 行可能含任意字节，文件按 ISO-8859-1 读取。
 */
public class ProcStatusCredentialSource implements ProcessCredentialSource {

    private final Path procRoot;

    public ProcStatusCredentialSource(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public Credentials credentialsOf(long pid) throws CredentialException {
        if (pid <= 0) {
            throw new CredentialException("Invalid pid: " + pid);
        }
        Path status = procRoot.resolve(Long.toString(pid)).resolve("status");
        List<String> lines;
        try {
            lines = Files.readAllLines(status, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new CredentialException("Cannot read " + status, e);
        }
        return parseStatus(lines);
    }

    static Credentials parseStatus(List<String> lines) throws CredentialException {
        long[] uids = null;
        long[] gids = null;
        List<Long> groups = null;

        for (String line : lines) {
            if (line.startsWith("Uid:")) {
                uids = numbers(line);
            } else if (line.startsWith("Gid:")) {
                gids = numbers(line);
            } else if (line.startsWith("Groups:")) {
                groups = new ArrayList<>();
                for (long gid : numbers(line)) {
                    groups.add(gid);
                }
            }
        }

        if (uids == null || uids.length < 2) {
            throw new CredentialException("Missing or short Uid line");
        }
        if (gids == null || gids.length < 1) {
            throw new CredentialException("Missing Gid line");
        }
        if (groups == null) {
            throw new CredentialException("Missing Groups line");
        }
        return new Credentials(uids[0], uids[1], gids[0], groups);
    }

    private static long[] numbers(String line) throws CredentialException {
        String values = line.substring(line.indexOf(':') + 1).strip();
        if (values.isEmpty()) {
            return new long[0];
        }
        String[] tokens = values.split("\\s+");
        long[] result = new long[tokens.length];
        try {
            for (int i = 0; i < tokens.length; i++) {
                result[i] = Long.parseLong(tokens[i]);
            }
        } catch (NumberFormatException e) {
            throw new CredentialException("Malformed status line: " + line, e);
        }
        return result;
    }
}
