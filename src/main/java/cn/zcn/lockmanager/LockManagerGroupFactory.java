package cn.zcn.lockmanager;

import cn.zcn.lockmanager.dependency.DependencyProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按域缓存 {@link LockManagerGroup}，所有域共用同一份锁管理器配置和依赖提供者。
 * 由应用的组装入口持有，不是全局单例。
 */
public class LockManagerGroupFactory {

    private final String defaultDomain;
    private final List<Map<String, Object>> lockManagerConfigs;
    private final DependencyProvider dependencyProvider;
    private final Map<LockManagerKind, LockManagerFactory> factories;
    private final Map<String, LockManagerGroup> groups = new ConcurrentHashMap<>();

    public LockManagerGroupFactory(String defaultDomain, List<Map<String, Object>> lockManagerConfigs,
                                   DependencyProvider dependencyProvider) {
        this(defaultDomain, lockManagerConfigs, dependencyProvider, LockManagerFactories.defaults());
    }

    public LockManagerGroupFactory(String defaultDomain, List<Map<String, Object>> lockManagerConfigs,
                                   DependencyProvider dependencyProvider, Map<LockManagerKind, LockManagerFactory> factories) {
        this.defaultDomain = defaultDomain;
        this.lockManagerConfigs = Collections.unmodifiableList(new ArrayList<>(lockManagerConfigs));
        this.dependencyProvider = dependencyProvider;
        this.factories = factories;
    }

    /**
     * @param domain 域，为 null 时使用默认域
     * @return 该域的注册表，同一个域始终返回同一个实例
     * @throws cn.zcn.lockmanager.exception.ConfigException 配置非法
     */
    public LockManagerGroup getLockManagerGroup(String domain) {
        String key = domain == null ? defaultDomain : domain;
        return groups.computeIfAbsent(key, d -> new LockManagerGroup(d, lockManagerConfigs, dependencyProvider, factories));
    }

    /**
     * 丢弃所有已缓存的注册表，仅供测试使用
     */
    public void resetForTesting() {
        groups.clear();
    }
}
