package com.groupcheck.core.spi;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.api.security.Credentials;

/**
 * 按进程号查询凭证 SPI
 */
public interface ProcessCredentialSource {

    /**
     * @throws CredentialException 进程不存在或记录无法解析
     */
    Credentials credentialsOf(long pid) throws CredentialException;
}
