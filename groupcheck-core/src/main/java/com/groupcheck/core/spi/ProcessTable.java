package com.groupcheck.core.spi;

import com.groupcheck.api.exception.CredentialException;

/**
 * 进程表 SPI
 */
public interface ProcessTable {

    /**
     * 读取进程启动时间（开机以来的时钟节拍数）
     *
     * @throws CredentialException 读取或解析失败
     */
    long startTimeOf(long pid) throws CredentialException;
}
