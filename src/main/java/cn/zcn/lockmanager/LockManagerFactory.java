package cn.zcn.lockmanager;

/**
 * 某一实现类型的锁管理器工厂
 */
@FunctionalInterface
public interface LockManagerFactory {

    /**
     * 根据完整配置创建可直接使用的锁管理器
     *
     * @param settings 合并了依赖句柄的配置
     * @return 锁管理器
     * @throws cn.zcn.lockmanager.exception.ConfigException 缺少必需的配置项或配置项非法
     */
    LockManager create(LockManagerSettings settings);
}
