package com.groupcheck.runtime.dbus;

import com.groupcheck.api.exception.InvalidSubjectException;
import com.groupcheck.api.security.AuthorityService;
import com.groupcheck.api.security.AuthorizationResult;
import lombok.extern.slf4j.Slf4j;
import org.freedesktop.dbus.interfaces.Properties;
import org.freedesktop.dbus.types.UInt32;
import org.freedesktop.dbus.types.Variant;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 导出到总线上的 Authority 对象
 * <p>
 * 只做线路类型与核心类型之间的转换，判定逻辑全部委托给 {@link AuthorityService}。
 * 同时实现 org.freedesktop.DBus.Properties 以提供三个只读属性。
 */
@Slf4j
public class AuthorityObject implements PolkitAuthority, Properties {

    public static final String PROP_BACKEND_NAME = "BackendName";
    public static final String PROP_BACKEND_VERSION = "BackendVersion";
    public static final String PROP_BACKEND_FEATURES = "BackendFeatures";

    private final AuthorityService authorityService;

    public AuthorityObject(AuthorityService authorityService) {
        this.authorityService = authorityService;
    }

    @Override
    public AuthorizationResultStruct CheckAuthorization(SubjectStruct subject, String actionId,
                                                        Map<String, String> details, UInt32 flags,
                                                        String cancellationId) {
        if (subject == null) {
            throw new InvalidSubjectError("Missing subject");
        }
        try {
            AuthorizationResult result = authorityService.checkAuthorization(
                    subject.kind,
                    unwrap(subject.details),
                    actionId,
                    details == null ? Map.of() : details,
                    flags == null ? 0L : flags.longValue(),
                    cancellationId);
            return AuthorizationResultStruct.from(result);
        } catch (InvalidSubjectException e) {
            throw new InvalidSubjectError(e.getMessage());
        }
    }

    @Override
    public void CancelCheckAuthorization(String cancellationId) {
        authorityService.cancelCheckAuthorization(cancellationId);
    }

    @Override
    public List<ActionDescriptionStruct> EnumerateActions(String locale) {
        return authorityService.enumerateActions(locale).stream()
                .map(ActionDescriptionStruct::from)
                .collect(Collectors.toList());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <A> A Get(String interfaceName, String propertyName) {
        checkInterface(interfaceName);
        switch (propertyName) {
            case PROP_BACKEND_NAME:
                return (A) authorityService.getBackendName();
            case PROP_BACKEND_VERSION:
                return (A) authorityService.getBackendVersion();
            case PROP_BACKEND_FEATURES:
                return (A) new UInt32(authorityService.getBackendFeatures());
            default:
                throw new PropertyAccessError(PropertyAccessError.UNKNOWN_PROPERTY, "No such property: " + propertyName);
        }
    }

    @Override
    public <A> void Set(String interfaceName, String propertyName, A value) {
        checkInterface(interfaceName);
        throw new PropertyAccessError(PropertyAccessError.READ_ONLY, "Property " + propertyName + " is read-only");
    }

    @Override
    public Map<String, Variant<?>> GetAll(String interfaceName) {
        checkInterface(interfaceName);
        Map<String, Variant<?>> all = new LinkedHashMap<>();
        all.put(PROP_BACKEND_NAME, new Variant<>(authorityService.getBackendName()));
        all.put(PROP_BACKEND_VERSION, new Variant<>(authorityService.getBackendVersion()));
        all.put(PROP_BACKEND_FEATURES, new Variant<>(new UInt32(authorityService.getBackendFeatures())));
        return all;
    }

    @Override
    public String getObjectPath() {
        return OBJECT_PATH;
    }

    @Override
    public boolean isRemote() {
        return false;
    }

    private void checkInterface(String interfaceName) {
        if (!INTERFACE_NAME.equals(interfaceName)) {
            throw new PropertyAccessError(PropertyAccessError.UNKNOWN_INTERFACE, "Unknown interface: " + interfaceName);
        }
    }

    /**
     * 去掉 Variant 包装，核心层只认识普通 Java 值（UInt32/UInt64 本身是 Number）
     */
    static Map<String, Object> unwrap(Map<String, Variant<?>> details) {
        Map<String, Object> plain = new HashMap<>();
        if (details == null) {
            return plain;
        }
        details.forEach((key, variant) -> {
            if (variant != null) {
                plain.put(key, variant.getValue());
            }
        });
        return plain;
    }
}
