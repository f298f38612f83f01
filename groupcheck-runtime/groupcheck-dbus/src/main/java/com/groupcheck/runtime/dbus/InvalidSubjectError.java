package com.groupcheck.runtime.dbus;

import org.freedesktop.dbus.exceptions.DBusExecutionException;

/**
 * 主体描述无效时返回给调用方的错误回复，只影响当前调用
 */
public class InvalidSubjectError extends DBusExecutionException {

    public static final String ERROR_NAME = "org.freedesktop.DBus.Error.InvalidArgs";

    private static final long serialVersionUID = 1L;

    public InvalidSubjectError(String message) {
        super(message);
        setType(ERROR_NAME);
    }
}
