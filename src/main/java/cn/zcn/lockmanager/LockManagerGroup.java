package cn.zcn.lockmanager;

import cn.zcn.lockmanager.dependency.DependencyProvider;
import cn.zcn.lockmanager.exception.ConfigException;
import cn.zcn.lockmanager.exception.LockManagerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 某个域下锁管理器的注册表。
 * <p>
 * 构造时只校验并保存配置，不创建任何锁管理器；每个名称对应的锁管理器在第一次 {@link #get(String)} 时创建，
 * 之后在注册表的生命周期内一直复用。不要直接创建，通过 {@link LockManagerGroupFactory} 获取。
 */
public class LockManagerGroup {

    public static final String DEFAULT = "default";
    public static final String FS_LOCK_MANAGER = "fsLockManager";
    public static final String LOGGER_CHANNEL = "LockManager";

    private static final Logger LOGGER = LoggerFactory.getLogger(LockManagerGroup.class);

    private static class RegistryEntry {
        private final LockManagerConfig config;
        private volatile LockManager instance;

        private RegistryEntry(LockManagerConfig config) {
            this.config = config;
        }
    }

    private final String domain;
    private final DependencyProvider dependencyProvider;
    private final Map<LockManagerKind, LockManagerFactory> factories;
    private final Map<String, RegistryEntry> managers;
    private final LockManager fallback = new NullLockManager();

    public LockManagerGroup(String domain, List<? extends Map<String, ?>> lockManagerConfigs, DependencyProvider dependencyProvider) {
        this(domain, lockManagerConfigs, dependencyProvider, LockManagerFactories.defaults());
    }

    /**
     * @param domain             所属域
     * @param lockManagerConfigs 原始配置记录，每条必须包含 name 和 class
     * @param dependencyProvider 依赖提供者
     * @param factories          实现类型到工厂的映射
     * @throws ConfigException 任一配置记录非法，此时不会产生注册表
     */
    public LockManagerGroup(String domain, List<? extends Map<String, ?>> lockManagerConfigs,
                            DependencyProvider dependencyProvider, Map<LockManagerKind, LockManagerFactory> factories) {
        this.domain = domain;
        this.dependencyProvider = dependencyProvider;
        this.factories = factories.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(factories));

        Map<String, RegistryEntry> entries = new LinkedHashMap<>();
        for (Map<String, ?> record : lockManagerConfigs) {
            LockManagerConfig config = LockManagerConfig.fromRecord(domain, record);
            if (!this.factories.containsKey(config.getKind())) {
                throw new ConfigException("No factory for lock manager `" + config.getName() + "` of kind " + config.getKind() + ".");
            }

            // 同名配置后者覆盖前者
            if (entries.put(config.getName(), new RegistryEntry(config)) != null) {
                LOGGER.warn("Lock manager `{}` is registered more than once in domain `{}`, the last one wins.", config.getName(), domain);
            }
        }

        this.managers = Collections.unmodifiableMap(entries);
    }

    public String getDomain() {
        return domain;
    }

    /**
     * @return 已注册的锁管理器名称
     */
    public Set<String> getNames() {
        return managers.keySet();
    }

    /**
     * 获取指定名称的锁管理器，首次获取时创建。并发的首次获取只会创建一个实例。
     * 创建失败时异常原样抛出，且不缓存失败结果，之后可以重试。
     *
     * @param name 名称
     * @return 锁管理器
     * @throws LockManagerNotFoundException 未注册该名称
     */
    public LockManager get(String name) {
        RegistryEntry entry = getEntry(name);

        LockManager instance = entry.instance;
        if (instance != null) {
            return instance;
        }

        synchronized (entry) {
            if (entry.instance == null) {
                entry.instance = create(entry.config);
            }
            return entry.instance;
        }
    }

    /**
     * 获取指定名称锁管理器的配置，不会创建锁管理器
     *
     * @param name 名称
     * @return class 与其余配置项合并后的只读视图
     * @throws LockManagerNotFoundException 未注册该名称
     */
    public Map<String, Object> config(String name) {
        return getEntry(name).config.asMap();
    }

    /**
     * 获取默认的锁管理器，未配置 {@code default} 时返回 {@link NullLockManager}。
     * <p>
     * 目前没有已知的调用方，保留前需要确认确实有用。
     *
     * @return 锁管理器
     */
    public LockManager getDefault() {
        return managers.containsKey(DEFAULT) ? get(DEFAULT) : fallback;
    }

    /**
     * 获取默认的锁管理器，未配置 {@code default} 时退回到 {@code fsLockManager}。
     * <p>
     * 目前没有已知的调用方，保留前需要确认确实有用。
     *
     * @return 锁管理器
     * @throws LockManagerNotFoundException 两者均未配置
     */
    public LockManager getAny() {
        return managers.containsKey(DEFAULT) ? get(DEFAULT) : get(FS_LOCK_MANAGER);
    }

    private RegistryEntry getEntry(String name) {
        RegistryEntry entry = managers.get(name);
        if (entry == null) {
            throw new LockManagerNotFoundException(name);
        }
        return entry;
    }

    private LockManager create(LockManagerConfig config) {
        LockManagerSettings.Builder settings = LockManagerSettings.builder(config);

        if (config.getKind().isDatabaseBacked()) {
            settings.localDbMaster(dependencyProvider.getConnection(config.getDomain()))
                    .srvCache(dependencyProvider.getLocalCache());
        }
        settings.logger(dependencyProvider.getLogger(LOGGER_CHANNEL));

        LockManager instance = factories.get(config.getKind()).create(settings.build());
        LOGGER.debug("Created lock manager `{}` ({}) for domain `{}`.", config.getName(), config.getSelector(), domain);
        return instance;
    }
}
