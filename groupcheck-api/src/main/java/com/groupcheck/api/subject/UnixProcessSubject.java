package com.groupcheck.api.subject;

/**
 * 进程主体
 *
 * @param pid       进程号
 * @param startTime 请求方声称的进程启动时间（开机以来的时钟节拍数），不可信，需与进程表比对
 */
public record UnixProcessSubject(long pid, long startTime) implements Subject {

    @Override
    public String kind() {
        return KIND_UNIX_PROCESS;
    }

    @Override
    public String describe() {
        return String.format("Unix process (pid: %d, start time: %d)", pid, startTime);
    }
}
