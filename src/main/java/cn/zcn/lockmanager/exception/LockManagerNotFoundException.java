package cn.zcn.lockmanager.exception;

/**
 * 按名称查找时，该名称没有注册锁管理器
 */
public class LockManagerNotFoundException extends LockManagerException {

    private final String name;

    public LockManagerNotFoundException(String name) {
        super("No lock manager defined with the name `" + name + "`.");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
