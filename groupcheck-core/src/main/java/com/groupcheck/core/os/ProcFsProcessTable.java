package com.groupcheck.core.os;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.core.spi.ProcessTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 基于 /proc/[pid]/stat 的进程表
 * <p>
 * 启动时间是第 22 个字段。第 2 个字段 comm 被括号包围，且自身可能含空格和括号，
 * 因此从最后一个 ')' 开始数字段。文件按字节读取（ISO-8859-1），comm 不要求是合法 UTF-8。
 */
public class ProcFsProcessTable implements ProcessTable {

    /**
     * ')' 之后第一个字段是第 3 个字段 (state)，启动时间在其后第 19 个
     */
    static final int START_TIME_OFFSET_AFTER_COMM = 19;

    private final Path procRoot;

    public ProcFsProcessTable(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public long startTimeOf(long pid) throws CredentialException {
        if (pid <= 0) {
            throw new CredentialException("Invalid pid: " + pid);
        }
        Path stat = procRoot.resolve(Long.toString(pid)).resolve("stat");
        String line;
        try (BufferedReader reader = Files.newBufferedReader(stat, StandardCharsets.ISO_8859_1)) {
            line = reader.readLine();
        } catch (IOException e) {
            throw new CredentialException("Cannot read " + stat, e);
        }
        if (line == null) {
            throw new CredentialException("Empty process record " + stat);
        }
        return parseStartTime(line);
    }

    static long parseStartTime(String statLine) throws CredentialException {
        int commEnd = statLine.lastIndexOf(')');
        if (commEnd < 0) {
            throw new CredentialException("Malformed stat record: no ')'");
        }
        String rest = statLine.substring(commEnd + 1).strip();
        String[] fields = rest.split(" ");
        if (fields.length <= START_TIME_OFFSET_AFTER_COMM) {
            throw new CredentialException("Malformed stat record: only " + fields.length + " fields after comm");
        }
        try {
            return Long.parseUnsignedLong(fields[START_TIME_OFFSET_AFTER_COMM]);
        } catch (NumberFormatException e) {
            throw new CredentialException("Malformed start time: " + fields[START_TIME_OFFSET_AFTER_COMM], e);
        }
    }
}
