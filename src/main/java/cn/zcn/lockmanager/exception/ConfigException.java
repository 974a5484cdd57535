package cn.zcn.lockmanager.exception;

/**
 * 配置错误：注册时缺少 name 或实现类型，或实现所需的配置项缺失、非法
 */
public class ConfigException extends LockManagerException {

    public ConfigException(String msg) {
        super(msg);
    }

    public ConfigException(String msg, Throwable t) {
        super(msg, t);
    }
}
