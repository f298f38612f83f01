package com.groupcheck.api.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Credentials 测试")
class CredentialsTest {

    @Test
    @DisplayName("uid 一致性")
    void uidConsistency() {
        assertTrue(new Credentials(1000, 1000, 1000, List.of()).isUidConsistent());
        assertFalse(new Credentials(1000, 0, 1000, List.of()).isUidConsistent());
    }

    @Test
    @DisplayName("附加组成员判断不计入主组")
    void supplementaryMembershipExcludesPrimary() {
        Credentials credentials = new Credentials(1000, 1000, 4, List.of(4L, 10L));

        assertTrue(credentials.hasSupplementaryGroup(10));
        assertFalse(credentials.hasSupplementaryGroup(4));
        assertFalse(credentials.hasSupplementaryGroup(27));
    }

    @Test
    @DisplayName("附加组列表被复制且不可变")
    void supplementaryGidsAreCopied() {
        List<Long> groups = new ArrayList<>(List.of(4L));
        Credentials credentials = new Credentials(1000, 1000, 1000, groups);
        groups.add(10L);

        assertEquals(List.of(4L), credentials.supplementaryGids());
        assertThrows(UnsupportedOperationException.class, () -> credentials.supplementaryGids().add(27L));
        assertEquals(List.of(), new Credentials(0, 0, 0, null).supplementaryGids());
    }
}
