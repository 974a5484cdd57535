package cn.zcn.lockmanager.exception;

/**
 * 锁管理器相关异常的基类
 */
public class LockManagerException extends RuntimeException {

    public LockManagerException(String msg) {
        super(msg);
    }

    public LockManagerException(String msg, Throwable t) {
        super(msg, t);
    }
}
