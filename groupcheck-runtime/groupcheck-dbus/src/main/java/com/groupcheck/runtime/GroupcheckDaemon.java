package com.groupcheck.runtime;

import com.groupcheck.api.exception.GroupcheckException;
import com.groupcheck.api.exception.TransportException;
import com.groupcheck.core.config.GroupcheckConfig;
import com.groupcheck.core.config.GroupcheckConfigLoader;
import com.groupcheck.core.os.ProcStatusCredentialSource;
import com.groupcheck.core.policy.PolicyStore;
import com.groupcheck.core.service.AuthorityServiceFactory;
import com.groupcheck.core.service.DefaultAuthorityService;
import com.groupcheck.runtime.dbus.AuthorityObject;
import com.groupcheck.runtime.dbus.DBusPeerCredentialSource;
import com.groupcheck.runtime.dbus.PolkitAuthority;
import lombok.extern.slf4j.Slf4j;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * groupcheck 守护进程入口
 * <p>
 * 启动顺序：配置 → 策略 → 连接总线 → 导出对象 → 申请服务名 → 服务直到连接断开。
 * 服务开始前任何一步失败都以非零状态退出。
 * <p>
 * 用法：{@code groupcheck [config.yml]}
 */
@Slf4j
public class GroupcheckDaemon {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    /**
     * 连接建立方式，测试时可替换
     */
    @FunctionalInterface
    public interface BusConnector {
        DBusConnection connect(GroupcheckConfig.BusType busType) throws DBusException;
    }

    private final BusConnector connector;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public GroupcheckDaemon() {
        this(GroupcheckDaemon::openConnection);
    }

    public GroupcheckDaemon(BusConnector connector) {
        this.connector = connector;
    }

    public static void main(String[] args) {
        int code = new GroupcheckDaemon().run(args);
        log.info("Exiting daemon.");
        System.exit(code);
    }

    public int run(String[] args) {
        long start = System.currentTimeMillis();
        log.info("Starting groupcheck...");

        GroupcheckConfig config;
        PolicyStore store;
        try {
            config = args.length > 0 ? GroupcheckConfigLoader.load(Path.of(args[0])) : GroupcheckConfig.defaults();
            store = AuthorityServiceFactory.loadPolicy(config);
        } catch (GroupcheckException e) {
            log.error("Error loading configuration or policy data: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        DBusConnection connection;
        try {
            connection = connector.connect(config.getBus());
        } catch (DBusException e) {
            log.error("Error connecting to bus: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            DefaultAuthorityService service = AuthorityServiceFactory.create(config, store,
                    new DBusPeerCredentialSource(busDaemon(connection),
                            new ProcStatusCredentialSource(Path.of(config.getProcRoot()))));
            register(connection, service);
        } catch (TransportException e) {
            log.error("{}", e.getMessage(), e.getCause());
            closeQuietly(connection);
            return EXIT_FAILURE;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("groupcheck shutting down...");
            closeQuietly(connection);
            stopped.countDown();
        }));

        log.info("groupcheck serving {} action(s) on {} bus, started in {} ms",
                store.size(), config.getBus(), System.currentTimeMillis() - start);

        awaitDisconnect(connection);
        return EXIT_OK;
    }

    static void register(DBusConnection connection, DefaultAuthorityService service) {
        try {
            connection.exportObject(PolkitAuthority.OBJECT_PATH, new AuthorityObject(service));
        } catch (DBusException e) {
            throw new TransportException("Error creating D-Bus object", e);
        }
        try {
            connection.requestBusName(PolkitAuthority.SERVICE_NAME);
        } catch (DBusException e) {
            throw new TransportException("Error requesting service name", e);
        }
        log.info("Registered {} at {}", PolkitAuthority.SERVICE_NAME, PolkitAuthority.OBJECT_PATH);
    }

    private static DBus busDaemon(DBusConnection connection) {
        try {
            return connection.getRemoteObject("org.freedesktop.DBus", "/org/freedesktop/DBus", DBus.class);
        } catch (DBusException e) {
            throw new TransportException("Error obtaining bus daemon proxy", e);
        }
    }

    private void awaitDisconnect(DBusConnection connection) {
        try {
            while (connection.isConnected()) {
                if (stopped.await(1, TimeUnit.SECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static DBusConnection openConnection(GroupcheckConfig.BusType busType) throws DBusException {
        if (busType == GroupcheckConfig.BusType.SESSION) {
            return DBusConnectionBuilder.forSessionBus().build();
        }
        return DBusConnectionBuilder.forSystemBus().build();
    }

    private static void closeQuietly(DBusConnection connection) {
        try {
            connection.close();
        } catch (IOException e) {
            log.warn("Error closing bus connection: {}", e.getMessage());
        }
    }
}
