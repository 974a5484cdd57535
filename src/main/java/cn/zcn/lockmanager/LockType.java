package cn.zcn.lockmanager;

/**
 * 锁类型
 */
public enum LockType {

    /**
     * 共享锁，多个持有者可同时持有
     */
    SHARED,

    /**
     * 排他锁，同一时刻只允许一个持有者
     */
    EXCLUSIVE
}
