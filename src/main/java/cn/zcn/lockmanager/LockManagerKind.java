package cn.zcn.lockmanager;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 锁管理器的实现类型。配置中的 {@code class} 字段通过别名映射到具体类型。
 */
public enum LockManagerKind {

    DB(true, "DBLockManager", "MySqlLockManager", "db"),
    FS(false, "FSLockManager", "fs"),
    REDIS(false, "RedisLockManager", "redis"),
    ZOOKEEPER(false, "ZookeeperLockManager", "zookeeper"),
    NULL(false, "NullLockManager", "null");

    private final boolean databaseBacked;
    private final List<String> aliases;

    LockManagerKind(boolean databaseBacked, String... aliases) {
        this.databaseBacked = databaseBacked;
        this.aliases = Collections.unmodifiableList(Arrays.asList(aliases));
    }

    /**
     * 是否依赖数据库连接和本地缓存
     */
    public boolean isDatabaseBacked() {
        return databaseBacked;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public static Optional<LockManagerKind> fromSelector(String selector) {
        for (LockManagerKind kind : values()) {
            for (String alias : kind.aliases) {
                if (alias.equalsIgnoreCase(selector)) {
                    return Optional.of(kind);
                }
            }
            if (kind.name().equalsIgnoreCase(selector)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
