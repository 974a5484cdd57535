package cn.zcn.lockmanager;

import cn.zcn.lockmanager.dependency.LocalCache;
import cn.zcn.lockmanager.dependency.TransactionalConnection;
import cn.zcn.lockmanager.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 传给锁管理器工厂的完整配置：注册时的配置项，加上注册表注入的域、日志记录器以及数据库依赖
 */
public class LockManagerSettings {

    public static final String LOGGER = "logger";
    public static final String SRV_CACHE = "srvCache";
    public static final String DB_SERVERS = "dbServers";
    public static final String LOCAL_DB_MASTER = "localDBMaster";

    private final LockManagerKind kind;
    private final Map<String, Object> values;

    private LockManagerSettings(LockManagerKind kind, Map<String, Object> values) {
        this.kind = kind;
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder(LockManagerConfig config) {
        return new Builder(config.getKind(), config.getSettings());
    }

    public static Builder builder(LockManagerKind kind) {
        return new Builder(kind, Collections.emptyMap());
    }

    public LockManagerKind getKind() {
        return kind;
    }

    public String getName() {
        return getString(LockManagerConfig.NAME, null);
    }

    public String getDomain() {
        return getString(LockManagerConfig.DOMAIN, null);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw new ConfigException("Setting `" + key + "` must be a string.");
        }
        return (String) value;
    }

    public String requireString(String key) {
        String value = getString(key, null);
        if (value == null || value.isEmpty()) {
            throw new ConfigException("Missing required setting `" + key + "` for lock manager `" + getName() + "`.");
        }
        return value;
    }

    public long getLong(String key, long defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("Setting `" + key + "` must be a number.", e);
            }
        }
        throw new ConfigException("Setting `" + key + "` must be a number.");
    }

    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new ConfigException("Setting `" + key + "` must be a map.");
        }

        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
            map.put(String.valueOf(e.getKey()), e.getValue());
        }
        return Collections.unmodifiableMap(map);
    }

    public Logger getLogger() {
        Object logger = values.get(LOGGER);
        return logger instanceof Logger ? (Logger) logger : LoggerFactory.getLogger(LockManager.class);
    }

    /**
     * @return {@code dbServers.localDBMaster} 中注入的连接，未注入时返回 null
     */
    public TransactionalConnection getLocalDbMaster() {
        Object conn = getMap(DB_SERVERS).get(LOCAL_DB_MASTER);
        return conn instanceof TransactionalConnection ? (TransactionalConnection) conn : null;
    }

    public LocalCache getSrvCache() {
        Object cache = values.get(SRV_CACHE);
        return cache instanceof LocalCache ? (LocalCache) cache : null;
    }

    public static class Builder {
        private final LockManagerKind kind;
        private final Map<String, Object> values;

        private Builder(LockManagerKind kind, Map<String, Object> values) {
            this.kind = kind;
            this.values = new LinkedHashMap<>(values);
        }

        public Builder put(String key, Object value) {
            values.put(key, value);
            return this;
        }

        public Builder logger(Logger logger) {
            return put(LOGGER, logger);
        }

        public Builder srvCache(LocalCache cache) {
            return put(SRV_CACHE, cache);
        }

        /**
         * 注入 {@code dbServers.localDBMaster}，保留配置中已有的其他数据库服务器
         */
        public Builder localDbMaster(TransactionalConnection connection) {
            Map<String, Object> dbServers = new LinkedHashMap<>();
            Object configured = values.get(DB_SERVERS);
            if (configured instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) configured).entrySet()) {
                    dbServers.put(String.valueOf(e.getKey()), e.getValue());
                }
            }
            dbServers.put(LOCAL_DB_MASTER, connection);
            return put(DB_SERVERS, Collections.unmodifiableMap(dbServers));
        }

        public LockManagerSettings build() {
            return new LockManagerSettings(kind, values);
        }
    }
}
