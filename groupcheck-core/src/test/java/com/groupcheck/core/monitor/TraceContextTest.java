package com.groupcheck.core.monitor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraceContext 测试")
class TraceContextTest {

    @AfterEach
    void tearDown() {
        TraceContext.clear();
    }

    @Test
    @DisplayName("开启后写入 MDC，重复开启返回同一个 ID")
    void startShouldBeIdempotent() {
        String tid = TraceContext.start();

        assertEquals(16, tid.length());
        assertEquals(tid, TraceContext.get());
        assertEquals(tid, MDC.get(TraceContext.MDC_KEY));
        assertEquals(tid, TraceContext.start());
    }

    @Test
    @DisplayName("清理后 ID 与 MDC 都为空")
    void clearShouldRemoveEverything() {
        TraceContext.start();
        TraceContext.clear();

        assertNull(TraceContext.get());
        assertNull(MDC.get(TraceContext.MDC_KEY));
    }

    @Test
    @DisplayName("不同线程互不可见")
    void shouldBeThreadLocal() throws Exception {
        String tid = TraceContext.start();

        String other = CompletableFuture.supplyAsync(TraceContext::get).get();

        assertNull(other);
        assertEquals(tid, TraceContext.get());
    }
}
