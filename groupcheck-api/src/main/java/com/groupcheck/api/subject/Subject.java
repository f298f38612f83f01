package com.groupcheck.api.subject;

/**
 * 请求授权的主体
 * <p>
 * 三种取值，各自是独立的不可变记录，不同类型的字段不会被混读：
 * <ul>
 * <li>{@link UnixProcessSubject} - 进程 (pid + 启动时间)</li>
 * <li>{@link UnixSessionSubject} - 登录会话</li>
 * <li>{@link SystemBusNameSubject} - 系统总线上的连接名</li>
 * </ul>
 * 每个请求新建，只在该请求内有效。
 *
 * @author groupcheck
 */
public interface Subject {

    String KIND_UNIX_PROCESS = "unix-process";
    String KIND_UNIX_SESSION = "unix-session";
    String KIND_SYSTEM_BUS_NAME = "system-bus-name";

    /**
     * 线路上使用的类型标签
     */
    String kind();

    /**
     * 用于审计日志的主体描述
     */
    String describe();
}
