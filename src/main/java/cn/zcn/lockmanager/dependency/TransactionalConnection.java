package cn.zcn.lockmanager.dependency;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 某个域专用于锁记录的数据库连接句柄，连接处于自动提交模式。
 */
public interface TransactionalConnection {

    /**
     * @return 连接所属的域
     */
    String getDomain();

    /**
     * 获取底层连接，首次调用时才真正建立连接
     *
     * @return 自动提交模式的连接
     * @throws SQLException 建立连接失败
     */
    Connection getConnection() throws SQLException;
}
