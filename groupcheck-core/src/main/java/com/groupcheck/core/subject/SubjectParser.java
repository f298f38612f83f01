package com.groupcheck.core.subject;

import com.groupcheck.api.exception.InvalidSubjectException;
import com.groupcheck.api.subject.Subject;
import com.groupcheck.api.subject.SystemBusNameSubject;
import com.groupcheck.api.subject.UnixProcessSubject;
import com.groupcheck.api.subject.UnixSessionSubject;

import java.util.Map;

/**
 * 主体描述解析
 * <p>
 * 输入是类型标签加详情键值表（值已由传输层解包）。各类型识别的键：
 * <ul>
 * <li>unix-process: pid (uint32), start-time (uint64)</li>
 * <li>unix-session: session-id (string)</li>
 * <li>system-bus-name: name (string)</li>
 * </ul>
 * 未识别的键直接忽略，便于协议向前兼容。缺失的键取默认值，交由校验阶段拒绝。
 */
public final class SubjectParser {

    public static final String KEY_PID = "pid";
    public static final String KEY_START_TIME = "start-time";
    public static final String KEY_SESSION_ID = "session-id";
    public static final String KEY_NAME = "name";

    /**
     * 字符串详情的最大长度（不含）
     */
    public static final int MAX_NAME_LENGTH = 256;

    private static final long UINT32_MAX = 0xFFFF_FFFFL;

    private SubjectParser() {
    }

    /**
     * @throws InvalidSubjectException 未知类型标签，或已知键的值类型/长度不合法
     */
    public static Subject parse(String kind, Map<String, ?> details) {
        Map<String, ?> d = details == null ? Map.of() : details;
        if (kind == null) {
            throw InvalidSubjectException.unknownKind(null);
        }
        switch (kind) {
            case Subject.KIND_UNIX_PROCESS:
                return new UnixProcessSubject(pid(d.get(KEY_PID)), startTime(d.get(KEY_START_TIME)));
            case Subject.KIND_UNIX_SESSION:
                return new UnixSessionSubject(string(KEY_SESSION_ID, d.get(KEY_SESSION_ID)));
            case Subject.KIND_SYSTEM_BUS_NAME:
                return new SystemBusNameSubject(string(KEY_NAME, d.get(KEY_NAME)));
            default:
                throw InvalidSubjectException.unknownKind(kind);
        }
    }

    private static long pid(Object value) {
        if (value == null) {
            return 0L;
        }
        long pid = number(KEY_PID, value);
        if (pid < 0 || pid > UINT32_MAX) {
            throw new InvalidSubjectException(InvalidSubjectException.Reason.INVALID_DETAIL_TYPE, KEY_PID,
                    "pid out of uint32 range: " + pid);
        }
        return pid;
    }

    private static long startTime(Object value) {
        return value == null ? 0L : number(KEY_START_TIME, value);
    }

    private static long number(String key, Object value) {
        if (!(value instanceof Number n)) {
            throw new InvalidSubjectException(InvalidSubjectException.Reason.INVALID_DETAIL_TYPE, key,
                    "Expected a number for '" + key + "' but got " + value.getClass().getSimpleName());
        }
        return n.longValue();
    }

    private static String string(String key, Object value) {
        if (value == null) {
            return "";
        }
        if (!(value instanceof String s)) {
            throw new InvalidSubjectException(InvalidSubjectException.Reason.INVALID_DETAIL_TYPE, key,
                    "Expected a string for '" + key + "' but got " + value.getClass().getSimpleName());
        }
        if (s.length() >= MAX_NAME_LENGTH) {
            throw new InvalidSubjectException(InvalidSubjectException.Reason.DETAIL_TOO_LONG, key,
                    "Value of '" + key + "' is too long (" + s.length() + " chars)");
        }
        return s;
    }
}
