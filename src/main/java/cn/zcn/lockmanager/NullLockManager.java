package cn.zcn.lockmanager;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * 不做任何事的锁管理器，所有加锁请求都直接成功。未配置任何锁基础设施时作为默认值使用。
 */
public class NullLockManager implements LockManager {

    public NullLockManager() {
    }

    public NullLockManager(LockManagerSettings settings) {
        this();
    }

    @Override
    public boolean lock(Collection<String> paths, LockType type, long timeout, TimeUnit unit) {
        return true;
    }

    @Override
    public boolean unlock(Collection<String> paths, LockType type) {
        return true;
    }
}
