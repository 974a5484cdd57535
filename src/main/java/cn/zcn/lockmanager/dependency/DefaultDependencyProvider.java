package cn.zcn.lockmanager.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 默认实现：按域从外部连接池取 {@link DataSource}，同一个域复用同一个连接引用，全进程共享一个本地缓存。
 */
public class DefaultDependencyProvider implements DependencyProvider {

    private final Function<String, DataSource> dataSources;
    private final LocalCache localCache;
    private final Map<String, TransactionalConnection> connections = new ConcurrentHashMap<>();

    public DefaultDependencyProvider(Function<String, DataSource> dataSources) {
        this(dataSources, new HashLocalCache());
    }

    public DefaultDependencyProvider(Function<String, DataSource> dataSources, LocalCache localCache) {
        this.dataSources = dataSources;
        this.localCache = localCache;
    }

    @Override
    public TransactionalConnection getConnection(String domain) {
        return connections.computeIfAbsent(domain, d -> {
            DataSource dataSource = dataSources.apply(d);
            if (dataSource == null) {
                throw new IllegalStateException("No data source for domain `" + d + "`.");
            }
            return new LazyConnectionRef(d, dataSource);
        });
    }

    @Override
    public LocalCache getLocalCache() {
        return localCache;
    }

    @Override
    public Logger getLogger(String channel) {
        return LoggerFactory.getLogger(channel);
    }
}
