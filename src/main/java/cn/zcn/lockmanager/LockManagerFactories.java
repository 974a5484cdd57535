package cn.zcn.lockmanager;

import cn.zcn.lockmanager.db.DBLockManager;
import cn.zcn.lockmanager.fs.FSLockManager;
import cn.zcn.lockmanager.redis.RedisLockManager;
import cn.zcn.lockmanager.zookeeper.ZookeeperLockManager;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 内置的实现类型到工厂的映射
 */
public final class LockManagerFactories {

    private static final Map<LockManagerKind, LockManagerFactory> DEFAULTS;

    static {
        Map<LockManagerKind, LockManagerFactory> factories = new EnumMap<>(LockManagerKind.class);
        factories.put(LockManagerKind.DB, DBLockManager::new);
        factories.put(LockManagerKind.FS, FSLockManager::new);
        factories.put(LockManagerKind.REDIS, RedisLockManager::new);
        factories.put(LockManagerKind.ZOOKEEPER, ZookeeperLockManager::new);
        factories.put(LockManagerKind.NULL, NullLockManager::new);
        DEFAULTS = Collections.unmodifiableMap(factories);
    }

    private LockManagerFactories() {
    }

    public static Map<LockManagerKind, LockManagerFactory> defaults() {
        return DEFAULTS;
    }

    /**
     * 在内置映射的基础上替换部分实现类型的工厂
     */
    public static Map<LockManagerKind, LockManagerFactory> withOverrides(Map<LockManagerKind, LockManagerFactory> overrides) {
        Map<LockManagerKind, LockManagerFactory> factories = new EnumMap<>(DEFAULTS);
        factories.putAll(overrides);
        return factories;
    }
}
