package com.groupcheck.runtime.dbus;

import com.groupcheck.api.security.AuthorizationResult;
import org.freedesktop.dbus.Struct;
import org.freedesktop.dbus.annotations.Position;

import java.util.HashMap;
import java.util.Map;

/**
 * 判定结果 (bba{ss})
 */
public class AuthorizationResultStruct extends Struct {

    @Position(0)
    public final boolean isAuthorized;

    @Position(1)
    public final boolean isChallenge;

    @Position(2)
    public final Map<String, String> details;

    public AuthorizationResultStruct(boolean isAuthorized, boolean isChallenge, Map<String, String> details) {
        this.isAuthorized = isAuthorized;
        this.isChallenge = isChallenge;
        this.details = details;
    }

    public static AuthorizationResultStruct from(AuthorizationResult result) {
        return new AuthorizationResultStruct(result.allowed(), result.challenge(), new HashMap<>(result.details()));
    }
}
