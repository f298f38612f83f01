package com.groupcheck.runtime.dbus;

import com.groupcheck.api.exception.CredentialException;
import com.groupcheck.api.security.Credentials;
import com.groupcheck.core.spi.BusPeerCredentialSource;
import com.groupcheck.core.spi.ProcessCredentialSource;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.types.UInt32;
import org.freedesktop.dbus.types.Variant;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 通过总线守护进程查询对端身份
 * <p>
 * uid 与附加组以总线守护进程在连接建立时记录的凭证（GetConnectionCredentials）为准。
 * 进程表只用来补充 effective uid 与主组，并且其 real uid 必须与总线记录的 uid 一致，
 * 否则说明 pid 已被其他进程复用，拒绝。
 */
public class DBusPeerCredentialSource implements BusPeerCredentialSource {

    static final String KEY_UNIX_USER_ID = "UnixUserID";
    static final String KEY_UNIX_GROUP_IDS = "UnixGroupIDs";
    static final String KEY_PROCESS_ID = "ProcessID";

    private final DBus busDaemon;
    private final ProcessCredentialSource processCredentials;

    public DBusPeerCredentialSource(DBus busDaemon, ProcessCredentialSource processCredentials) {
        this.busDaemon = busDaemon;
        this.processCredentials = processCredentials;
    }

    @Override
    public Credentials credentialsOf(String busName) throws CredentialException {
        if (busName == null || busName.isEmpty()) {
            throw new CredentialException("Empty bus name");
        }
        Map<String, Variant<?>> connection;
        try {
            connection = busDaemon.GetConnectionCredentials(busName);
        } catch (DBusExecutionException e) {
            throw new CredentialException("Bus daemon cannot identify " + busName, e);
        }
        if (connection == null) {
            throw new CredentialException("Bus daemon returned no credentials for " + busName);
        }

        long busUid = number(connection, KEY_UNIX_USER_ID)
                .orElseThrow(() -> new CredentialException("Bus daemon reported no uid for " + busName));
        Optional<Long> reportedPid = number(connection, KEY_PROCESS_ID);
        long pid = reportedPid.isPresent() ? reportedPid.get() : processIdOf(busName);

        Credentials process = processCredentials.credentialsOf(pid);
        if (process.realUid() != busUid) {
            throw new CredentialException(String.format("uid of pid %d (%d) differs from uid of %s (%d)",
                    pid, process.realUid(), busName, busUid));
        }

        List<Long> groups = groupIds(connection.get(KEY_UNIX_GROUP_IDS));
        return new Credentials(process.realUid(), process.effectiveUid(), process.primaryGid(),
                groups != null ? groups : process.supplementaryGids());
    }

    private long processIdOf(String busName) throws CredentialException {
        UInt32 pid;
        try {
            pid = busDaemon.GetConnectionUnixProcessID(busName);
        } catch (DBusExecutionException e) {
            throw new CredentialException("Bus daemon cannot identify " + busName, e);
        }
        if (pid == null) {
            throw new CredentialException("Bus daemon returned no pid for " + busName);
        }
        return pid.longValue();
    }

    private static Optional<Long> number(Map<String, Variant<?>> connection, String key)
            throws CredentialException {
        Variant<?> variant = connection.get(key);
        if (variant == null || variant.getValue() == null) {
            return Optional.empty();
        }
        if (!(variant.getValue() instanceof Number n)) {
            throw new CredentialException("Unexpected type for " + key + ": " + variant.getValue().getClass().getName());
        }
        return Optional.of(n.longValue());
    }

    /**
     * @return 总线记录的附加组；未提供时为 null
     */
    private static List<Long> groupIds(Variant<?> variant) throws CredentialException {
        if (variant == null || variant.getValue() == null) {
            return null;
        }
        Object value = variant.getValue();
        List<Long> groups = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                groups.add(gid(element));
            }
        } else if (value.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) {
                groups.add(gid(Array.get(value, i)));
            }
        } else {
            throw new CredentialException("Unexpected type for " + KEY_UNIX_GROUP_IDS + ": " + value.getClass().getName());
        }
        return groups;
    }

    private static long gid(Object element) throws CredentialException {
        if (!(element instanceof Number n)) {
            throw new CredentialException("Unexpected group id: " + element);
        }
        return n.longValue();
    }
}
