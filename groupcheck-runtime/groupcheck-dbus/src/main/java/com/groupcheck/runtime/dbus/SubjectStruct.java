package com.groupcheck.runtime.dbus;

import org.freedesktop.dbus.Struct;
import org.freedesktop.dbus.annotations.Position;
import org.freedesktop.dbus.types.Variant;

import java.util.Map;

/**
 * 主体 (sa{sv})：类型标签 + 详情
 */
public class SubjectStruct extends Struct {

    @Position(0)
    public final String kind;

    @Position(1)
    public final Map<String, Variant<?>> details;

    public SubjectStruct(String kind, Map<String, Variant<?>> details) {
        this.kind = kind;
        this.details = details;
    }
}
