package cn.zcn.lockmanager;

import java.util.UUID;

/**
 * 锁管理器实例的会话 ID，每个实例唯一，用于在后端区分锁的持有者。这里使用 UUID 实现。
 */
public final class SessionId {

    private final String value;

    private SessionId(String value) {
        this.value = value;
    }

    public static SessionId create() {
        return new SessionId(UUID.randomUUID().toString().replace("-", ""));
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
