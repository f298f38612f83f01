package com.groupcheck.api.subject;

/**
 * 系统总线连接名主体，例如 ":1.174"
 */
public record SystemBusNameSubject(String busName) implements Subject {

    @Override
    public String kind() {
        return KIND_SYSTEM_BUS_NAME;
    }

    @Override
    public String describe() {
        return "System bus name " + busName;
    }
}
