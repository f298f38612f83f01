package com.groupcheck.core.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolicyStore 单元测试")
class PolicyStoreTest {

    @Test
    @DisplayName("查询区分大小写且精确匹配")
    void lookupShouldBeExactAndCaseSensitive() {
        PolicyStore store = PolicyStore.of(List.of(new PolicyRule("org.example.Reboot", List.of("adm"))));

        assertTrue(store.lookup("org.example.Reboot").isPresent());
        assertTrue(store.lookup("org.example.reboot").isEmpty());
        assertTrue(store.lookup("org.example").isEmpty());
        assertTrue(store.lookup(null).isEmpty());
    }

    @Test
    @DisplayName("规则集合不可修改")
    void rulesShouldBeReadOnly() {
        PolicyStore store = PolicyStore.of(List.of(new PolicyRule("a", List.of("adm"))));

        assertThrows(UnsupportedOperationException.class, () -> store.rules().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> store.lookup("a").orElseThrow().allowedGroups().add("wheel"));
    }

    @Test
    @DisplayName("构建时拒绝重复的动作 ID")
    void shouldRejectDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> PolicyStore.of(List.of(
                new PolicyRule("a", List.of("adm")),
                new PolicyRule("a", List.of("wheel")))));
    }

    @Test
    @DisplayName("空表")
    void emptyStore() {
        PolicyStore store = PolicyStore.of(List.of());

        assertTrue(store.isEmpty());
        assertEquals(0, store.size());
        assertTrue(store.lookup("a").isEmpty());
    }
}
