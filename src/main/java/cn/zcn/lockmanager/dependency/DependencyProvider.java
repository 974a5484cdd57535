package cn.zcn.lockmanager.dependency;

import org.slf4j.Logger;

/**
 * 为锁管理器提供共享的基础设施。注册表只在构造锁管理器时借用这些句柄，不负责它们的生命周期。
 */
public interface DependencyProvider {

    /**
     * @param domain 域
     * @return 该域专用于锁记录的自动提交连接
     */
    TransactionalConnection getConnection(String domain);

    /**
     * @return 进程内缓存
     */
    LocalCache getLocalCache();

    /**
     * @param channel 日志通道名
     * @return 日志记录器
     */
    Logger getLogger(String channel);
}
