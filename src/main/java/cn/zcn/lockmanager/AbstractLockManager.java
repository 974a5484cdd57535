package cn.zcn.lockmanager;

import org.slf4j.Logger;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 锁管理器骨架。
 * <p>
 * 维护本实例在每个路径上各类型锁的引用计数：重复加锁只增加计数，计数归零时才真正释放后端的锁；
 * 持有排他锁时再申请同一路径的共享锁直接视为成功。子类只需实现一次性、全有或全无的 {@link #doLock} 和 {@link #doUnlock}。
 */
public abstract class AbstractLockManager implements LockManager {

    private static class LockHold {
        private int count;

        /**
         * 该持有在后端实际占用的锁类型。null 表示只有计数，由同一路径上的排他锁覆盖；
         * 排他锁先于共享锁释放时，后端排他锁转交给共享锁，直到共享锁释放。
         */
        private LockType backend;
    }

    private static final long MIN_BACKOFF_MILLIS = 10;
    private static final long MAX_BACKOFF_MILLIS = 500;

    protected final Logger logger;
    protected final SessionId session;
    protected final String domain;

    private final Map<String, Map<LockType, LockHold>> locksHeld = new HashMap<>();

    protected AbstractLockManager(LockManagerSettings settings) {
        this.logger = settings.getLogger();
        this.domain = settings.getDomain();
        this.session = SessionId.create();
    }

    @Override
    public boolean lock(Collection<String> paths, LockType type, long timeout, TimeUnit unit) throws InterruptedException {
        Set<String> uniquePaths = new LinkedHashSet<>(paths);
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        long backoff = MIN_BACKOFF_MILLIS;

        while (true) {
            synchronized (this) {
                List<String> toAcquire = new ArrayList<>();
                for (String path : uniquePaths) {
                    if (!isHeld(path, type) && !holdsBackendExclusive(path)) {
                        toAcquire.add(path);
                    }
                }

                if (toAcquire.isEmpty() || doLock(toAcquire, type)) {
                    for (String path : uniquePaths) {
                        increase(path, type, toAcquire.contains(path));
                    }
                    return true;
                }
            }

            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                logger.debug("Failed to acquire {} lock on {} within timeout.", type, uniquePaths);
                return false;
            }

            TimeUnit.MILLISECONDS.sleep(Math.min(backoff, remainingMillis));
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MILLIS);
        }
    }

    @Override
    public synchronized boolean unlock(Collection<String> paths, LockType type) {
        boolean ok = true;
        Map<LockType, List<String>> toRelease = new EnumMap<>(LockType.class);

        for (String path : new LinkedHashSet<>(paths)) {
            Map<LockType, LockHold> holds = locksHeld.get(path);
            LockHold hold = holds == null ? null : holds.get(type);

            if (hold == null) {
                logger.warn("Cannot unlock {} lock on `{}`, it is not held.", type, path);
                ok = false;
                continue;
            }

            if (--hold.count == 0) {
                holds.remove(type);

                LockType backend = hold.backend;
                LockHold shared = holds.get(LockType.SHARED);
                if (backend == LockType.EXCLUSIVE && shared != null && shared.backend == null) {
                    // 共享锁仍在使用，保留后端排他锁
                    shared.backend = LockType.EXCLUSIVE;
                    backend = null;
                }

                if (holds.isEmpty()) {
                    locksHeld.remove(path);
                }
                if (backend != null) {
                    toRelease.computeIfAbsent(backend, t -> new ArrayList<>()).add(path);
                }
            }
        }

        for (Map.Entry<LockType, List<String>> e : toRelease.entrySet()) {
            if (!doUnlock(e.getValue(), e.getKey())) {
                ok = false;
            }
        }

        return ok;
    }

    /**
     * 判断本实例是否已持有指定类型的锁，排他锁满足共享锁的申请
     */
    public synchronized boolean isHeld(String path, LockType type) {
        Map<LockType, LockHold> holds = locksHeld.get(path);
        if (holds == null) {
            return false;
        }
        return holds.containsKey(type) || (type == LockType.SHARED && holds.containsKey(LockType.EXCLUSIVE));
    }

    /**
     * 共享锁持有着转交来的后端排他锁
     */
    private boolean holdsBackendExclusive(String path) {
        Map<LockType, LockHold> holds = locksHeld.get(path);
        LockHold shared = holds == null ? null : holds.get(LockType.SHARED);
        return shared != null && shared.backend == LockType.EXCLUSIVE;
    }

    private void increase(String path, LockType type, boolean acquired) {
        Map<LockType, LockHold> holds = locksHeld.computeIfAbsent(path, p -> new EnumMap<>(LockType.class));
        LockHold hold = holds.get(type);

        if (hold == null) {
            hold = new LockHold();
            if (acquired) {
                hold.backend = type;
            } else if (type == LockType.EXCLUSIVE) {
                // 收回共享锁上的后端排他锁
                LockHold shared = holds.get(LockType.SHARED);
                shared.backend = null;
                hold.backend = LockType.EXCLUSIVE;
            }
            holds.put(type, hold);
        }

        hold.count++;
    }

    /**
     * @return 锁在后端使用的键，路径 SHA-1 的 36 进制表示
     */
    protected static String sha1Base36(String path) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest(path.getBytes(StandardCharsets.UTF_8));
            return new BigInteger(1, hash).toString(36);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available.", e);
        }
    }

    /**
     * 尝试一次性获取所有路径上的锁。失败时必须释放本次已获取的锁。
     *
     * @param paths 本实例尚未持有的路径
     * @param type  锁类型
     * @return true, 全部获取成功；false, 存在冲突
     */
    protected abstract boolean doLock(List<String> paths, LockType type);

    /**
     * 释放后端的锁
     *
     * @return true, 全部释放成功
     */
    protected abstract boolean doUnlock(List<String> paths, LockType type);
}
