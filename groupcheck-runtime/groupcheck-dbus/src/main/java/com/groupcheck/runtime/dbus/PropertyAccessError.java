package com.groupcheck.runtime.dbus;

import org.freedesktop.dbus.exceptions.DBusExecutionException;

/**
 * 属性访问失败：接口未知、属性未知或属性只读
 */
public class PropertyAccessError extends DBusExecutionException {

    public static final String UNKNOWN_INTERFACE = "org.freedesktop.DBus.Error.UnknownInterface";
    public static final String UNKNOWN_PROPERTY = "org.freedesktop.DBus.Error.UnknownProperty";
    public static final String READ_ONLY = "org.freedesktop.DBus.Error.PropertyReadOnly";

    private static final long serialVersionUID = 1L;

    public PropertyAccessError(String errorName, String message) {
        super(message);
        setType(errorName);
    }
}
