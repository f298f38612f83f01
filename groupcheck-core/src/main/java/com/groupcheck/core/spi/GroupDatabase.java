package com.groupcheck.core.spi;

import java.util.OptionalLong;

/**
 * 组数据库 SPI：组名 → gid
 */
public interface GroupDatabase {

    /**
     * @return 组不存在或数据库不可读时为空
     */
    OptionalLong gidOf(String groupName);
}
