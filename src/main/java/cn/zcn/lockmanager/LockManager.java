package cn.zcn.lockmanager;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 文件路径锁管理器。路径只是抽象的资源名，不要求真实存在。
 */
public interface LockManager extends AutoCloseable {

    /**
     * 对一组路径加锁。要么全部成功，要么全部失败，失败时不会持有其中任何一个新锁。
     *
     * @param paths   路径
     * @param type    锁类型
     * @param timeout 最长等待时间，0 表示只尝试一次
     * @param unit    时间单位
     * @return true, 全部加锁成功；false, 在等待时间内未能加锁
     * @throws InterruptedException 中断异常
     */
    boolean lock(Collection<String> paths, LockType type, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 释放一组路径上的锁
     *
     * @param paths 路径
     * @param type  锁类型
     * @return true, 全部释放成功；false, 存在未持有或释放失败的路径
     */
    boolean unlock(Collection<String> paths, LockType type);

    /**
     * 按锁类型批量加锁，任一类型失败时回滚已加的锁
     */
    default boolean lockByType(Map<LockType, ? extends Collection<String>> pathsByType, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        Map<LockType, Collection<String>> locked = new EnumMap<>(LockType.class);

        for (Map.Entry<LockType, ? extends Collection<String>> e : pathsByType.entrySet()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!lock(e.getValue(), e.getKey(), remaining, TimeUnit.NANOSECONDS)) {
                unlockByType(locked);
                return false;
            }
            locked.put(e.getKey(), e.getValue());
        }

        return true;
    }

    default boolean unlockByType(Map<LockType, ? extends Collection<String>> pathsByType) {
        boolean ok = true;
        for (Map.Entry<LockType, ? extends Collection<String>> e : pathsByType.entrySet()) {
            ok &= unlock(e.getValue(), e.getKey());
        }
        return ok;
    }

    /**
     * 释放锁管理器占用的资源（连接、定时器等）
     */
    @Override
    default void close() {
    }
}
