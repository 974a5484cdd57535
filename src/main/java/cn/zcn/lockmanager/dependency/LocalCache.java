package cn.zcn.lockmanager.dependency;

import java.util.concurrent.TimeUnit;

/**
 * 进程内缓存
 */
public interface LocalCache {

    Object get(String key);

    void set(String key, Object value, long ttl, TimeUnit unit);

    void delete(String key);
}
