package com.groupcheck.core.spi;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.api.security.Credentials;

/**
 * 按总线连接名查询对端凭证 SPI
 * 由传输层实现（总线守护进程掌握连接对端的身份）
 */
public interface BusPeerCredentialSource {

    /**
     * @param busName 连接名，例如 ":1.174"
     * @throws CredentialException 名称未知或凭证无法获取
     */
    Credentials credentialsOf(String busName) throws CredentialException;
}
