package cn.zcn.lockmanager.dependency;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * 延迟建立的连接引用。连接断开后下一次调用会重新建立。
 */
public class LazyConnectionRef implements TransactionalConnection {

    private final String domain;
    private final DataSource dataSource;

    private Connection connection;

    public LazyConnectionRef(String domain, DataSource dataSource) {
        this.domain = domain;
        this.dataSource = dataSource;
    }

    @Override
    public String getDomain() {
        return domain;
    }

    @Override
    public synchronized Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            Connection conn = dataSource.getConnection();
            conn.setAutoCommit(true);
            connection = conn;
        }
        return connection;
    }
}
