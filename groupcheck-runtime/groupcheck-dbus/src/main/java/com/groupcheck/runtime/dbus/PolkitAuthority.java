package com.groupcheck.runtime.dbus;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.types.UInt32;

import java.util.List;
import java.util.Map;

/**
 * org.freedesktop.PolicyKit1.Authority 接口
 * 方法名、参数顺序与签名需与现有客户端逐位一致。
 */
@DBusInterfaceName(PolkitAuthority.INTERFACE_NAME)
public interface PolkitAuthority extends DBusInterface {

    String SERVICE_NAME = "org.freedesktop.PolicyKit1";
    String OBJECT_PATH = "/org/freedesktop/PolicyKit1/Authority";
    String INTERFACE_NAME = "org.freedesktop.PolicyKit1.Authority";

    /**
     * (sa{sv})sa{ss}us → (bba{ss})
     */
    AuthorizationResultStruct CheckAuthorization(SubjectStruct subject, String actionId,
                                                 Map<String, String> details, UInt32 flags,
                                                 String cancellationId);

    /**
     * s → ()
     */
    void CancelCheckAuthorization(String cancellationId);

    /**
     * s → a(ssssssuuua{ss})
     */
    List<ActionDescriptionStruct> EnumerateActions(String locale);
}
