package cn.zcn.lockmanager.exception;

/**
 * 加锁、解锁过程中后端出现的非预期异常
 */
public class LockException extends LockManagerException {

    public LockException(String msg) {
        super(msg);
    }

    public LockException(String msg, Throwable t) {
        super(msg, t);
    }
}
