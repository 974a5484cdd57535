package cn.zcn.lockmanager.zookeeper;

import cn.zcn.lockmanager.AbstractLockManager;
import cn.zcn.lockmanager.LockManagerSettings;
import cn.zcn.lockmanager.LockType;
import cn.zcn.lockmanager.exception.ConfigException;
import cn.zcn.lockmanager.exception.LockException;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.recipes.locks.InterProcessMutex;
import org.apache.curator.framework.recipes.locks.InterProcessReadWriteLock;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.curator.utils.CloseableUtils;
import org.apache.curator.utils.PathUtils;
import org.apache.curator.utils.ZKPaths;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 基于 ZooKeeper 读写锁的锁管理器，每个路径对应 {@code basePath} 下的一个节点。
 * <p>
 * Curator 的锁与线程绑定，加锁和解锁需在同一线程中进行；持有共享锁时不能再申请同一路径的排他锁。
 */
public class ZookeeperLockManager extends AbstractLockManager {

    public static final String CONNECT_STRING = "connectString";
    public static final String BASE_PATH = "basePath";
    public static final String SESSION_TIMEOUT_MS = "sessionTimeoutMs";
    public static final String CONNECTION_TIMEOUT_MS = "connectionTimeoutMs";

    private static final String DEFAULT_BASE_PATH = "/filelocks";

    private final CuratorFramework client;
    private final boolean ownsClient;
    private final String basePath;
    private final Map<String, InterProcessReadWriteLock> locks = new HashMap<>();

    public ZookeeperLockManager(LockManagerSettings settings) {
        this(settings, newClient(settings), true);
    }

    public ZookeeperLockManager(LockManagerSettings settings, CuratorFramework client) {
        this(settings, client, false);
    }

    private ZookeeperLockManager(LockManagerSettings settings, CuratorFramework client, boolean ownsClient) {
        super(settings);

        this.basePath = settings.getString(BASE_PATH, DEFAULT_BASE_PATH);
        this.client = client;
        this.ownsClient = ownsClient;

        try {
            PathUtils.validatePath(basePath);
        } catch (IllegalArgumentException e) {
            if (ownsClient) {
                CloseableUtils.closeQuietly(client);
            }
            throw new ConfigException("Invalid setting `" + BASE_PATH + "`.", e);
        }
    }

    private static CuratorFramework newClient(LockManagerSettings settings) {
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(200, 3);
        CuratorFramework client = CuratorFrameworkFactory.newClient(
                settings.requireString(CONNECT_STRING),
                (int) settings.getLong(SESSION_TIMEOUT_MS, 60000),
                (int) settings.getLong(CONNECTION_TIMEOUT_MS, 15000),
                retryPolicy);
        client.start();
        return client;
    }

    @Override
    protected synchronized boolean doLock(List<String> paths, LockType type) {
        List<InterProcessMutex> acquired = new ArrayList<>();

        try {
            for (String path : paths) {
                InterProcessMutex mutex = getMutex(path, type);
                if (!mutex.acquire(0, TimeUnit.MILLISECONDS)) {
                    release(acquired);
                    return false;
                }
                acquired.add(mutex);
            }
            return true;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            release(acquired);
            throw new LockException("Failed to acquire " + type + " lock.", e);
        }
    }

    @Override
    protected synchronized boolean doUnlock(List<String> paths, LockType type) {
        List<InterProcessMutex> mutexes = new ArrayList<>();
        for (String path : paths) {
            mutexes.add(getMutex(path, type));
        }
        return release(mutexes);
    }

    private boolean release(List<InterProcessMutex> mutexes) {
        boolean ok = true;
        for (InterProcessMutex mutex : mutexes) {
            try {
                mutex.release();
            } catch (Exception e) {
                logger.warn("Failed to release zookeeper lock.", e);
                ok = false;
            }
        }
        return ok;
    }

    private InterProcessMutex getMutex(String path, LockType type) {
        InterProcessReadWriteLock lock = locks.computeIfAbsent(path,
                p -> new InterProcessReadWriteLock(client, ZKPaths.makePath(basePath, sha1Base36(p))));
        return type == LockType.SHARED ? lock.readLock() : lock.writeLock();
    }

    @Override
    public synchronized void close() {
        locks.clear();
        if (ownsClient) {
            CloseableUtils.closeQuietly(client);
        }
    }
}
