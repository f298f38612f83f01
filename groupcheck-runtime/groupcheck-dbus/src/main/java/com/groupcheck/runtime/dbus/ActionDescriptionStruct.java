package com.groupcheck.runtime.dbus;

import com.groupcheck.api.security.ActionDescription;
import org.freedesktop.dbus.Struct;
import org.freedesktop.dbus.annotations.Position;
import org.freedesktop.dbus.types.UInt32;

import java.util.HashMap;
import java.util.Map;

/**
 * 动作描述 (ssssssuuua{ss})
 */
public class ActionDescriptionStruct extends Struct {

    @Position(0)
    public final String actionId;
    @Position(1)
    public final String description;
    @Position(2)
    public final String message;
    @Position(3)
    public final String vendorName;
    @Position(4)
    public final String vendorUrl;
    @Position(5)
    public final String iconName;
    @Position(6)
    public final UInt32 implicitAny;
    @Position(7)
    public final UInt32 implicitInactive;
    @Position(8)
    public final UInt32 implicitActive;
    @Position(9)
    public final Map<String, String> annotations;

    public ActionDescriptionStruct(String actionId, String description, String message, String vendorName,
                                   String vendorUrl, String iconName, UInt32 implicitAny, UInt32 implicitInactive,
                                   UInt32 implicitActive, Map<String, String> annotations) {
        this.actionId = actionId;
        this.description = description;
        this.message = message;
        this.vendorName = vendorName;
        this.vendorUrl = vendorUrl;
        this.iconName = iconName;
        this.implicitAny = implicitAny;
        this.implicitInactive = implicitInactive;
        this.implicitActive = implicitActive;
        this.annotations = annotations;
    }

    public static ActionDescriptionStruct from(ActionDescription action) {
        return new ActionDescriptionStruct(
                action.actionId(),
                action.description(),
                action.message(),
                action.vendorName(),
                action.vendorUrl(),
                action.iconName(),
                new UInt32(action.implicitAny()),
                new UInt32(action.implicitInactive()),
                new UInt32(action.implicitActive()),
                new HashMap<>(action.annotations()));
    }
}
