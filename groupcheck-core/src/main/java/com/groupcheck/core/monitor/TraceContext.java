package com.groupcheck.core.monitor;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 请求追踪上下文
 * 为每次授权检查生成 TraceId，并写入 MDC 的 traceId 键，便于把调试日志与审计行关联。
 */
public class TraceContext {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    /**
     * 开启或获取当前 TraceId
     */
    public static String start() {
        String tid = TRACE_ID.get();
        if (tid == null) {
            tid = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
            TRACE_ID.set(tid);
            MDC.put(MDC_KEY, tid);
        }
        return tid;
    }

    public static String get() {
        return TRACE_ID.get();
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }
}
