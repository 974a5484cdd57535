package cn.zcn.lockmanager.db;

import cn.zcn.lockmanager.AbstractLockManager;
import cn.zcn.lockmanager.LockManagerSettings;
import cn.zcn.lockmanager.LockType;
import cn.zcn.lockmanager.dependency.LocalCache;
import cn.zcn.lockmanager.dependency.TransactionalConnection;
import cn.zcn.lockmanager.exception.ConfigException;
import cn.zcn.lockmanager.exception.LockException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 基于数据库锁表的锁管理器。
 * <p>
 * 共享锁写入 {@code <prefix>_shared}，排他锁写入 {@code <prefix>_exclusive}（键为主键），
 * 写入后再检查另一张表中是否有其他会话的冲突记录。数据库连接不可用时，在本地缓存中标记
 * {@code safeDelay} 秒，期间的加锁请求直接失败。
 * <pre>
 * CREATE TABLE filelocks_shared (
 *   fls_key VARCHAR(31) NOT NULL, fls_session VARCHAR(32) NOT NULL, PRIMARY KEY (fls_key, fls_session));
 * CREATE TABLE filelocks_exclusive (
 *   fle_key VARCHAR(31) NOT NULL PRIMARY KEY, fle_session VARCHAR(32) NOT NULL);
 * </pre>
 */
public class DBLockManager extends AbstractLockManager {

    public static final String SAFE_DELAY = "safeDelay";
    public static final String LOCK_TABLE = "lockTable";

    private static final long DEFAULT_SAFE_DELAY = 60;
    private static final String DEFAULT_LOCK_TABLE = "filelocks";
    private static final String DOWN_KEY_PREFIX = "dblockmanager:down:";

    private final TransactionalConnection connection;
    private final LocalCache srvCache;
    private final long safeDelaySeconds;

    private final String insertShared;
    private final String insertExclusive;
    private final String countExclusive;
    private final String countShared;
    private final String deleteShared;
    private final String deleteExclusive;

    public DBLockManager(LockManagerSettings settings) {
        super(settings);

        this.connection = settings.getLocalDbMaster();
        if (connection == null) {
            throw new ConfigException("Missing database connection `" + LockManagerSettings.DB_SERVERS + "."
                    + LockManagerSettings.LOCAL_DB_MASTER + "` for lock manager `" + settings.getName() + "`.");
        }
        this.srvCache = settings.getSrvCache();
        this.safeDelaySeconds = settings.getLong(SAFE_DELAY, DEFAULT_SAFE_DELAY);
        if (safeDelaySeconds <= 0) {
            throw new ConfigException("Setting `" + SAFE_DELAY + "` must be positive.");
        }

        String table = settings.getString(LOCK_TABLE, DEFAULT_LOCK_TABLE);
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new ConfigException("Invalid lock table name `" + table + "`.");
        }

        String shared = table + "_shared";
        String exclusive = table + "_exclusive";
        this.insertShared = "INSERT INTO " + shared + " (fls_key, fls_session) VALUES (?, ?)";
        this.insertExclusive = "INSERT INTO " + exclusive + " (fle_key, fle_session) VALUES (?, ?)";
        this.countExclusive = "SELECT COUNT(*) FROM " + exclusive + " WHERE fle_key = ? AND fle_session <> ?";
        this.countShared = "SELECT COUNT(*) FROM " + shared + " WHERE fls_key = ? AND fls_session <> ?";
        this.deleteShared = "DELETE FROM " + shared + " WHERE fls_key = ? AND fls_session = ?";
        this.deleteExclusive = "DELETE FROM " + exclusive + " WHERE fle_key = ? AND fle_session = ?";
    }

    @Override
    protected boolean doLock(List<String> paths, LockType type) {
        Connection conn = getConnectionIfUp();
        if (conn == null) {
            return false;
        }

        List<String> locked = new ArrayList<>();
        try {
            for (String path : paths) {
                if (!doSingleLock(conn, sha1Base36(path), type)) {
                    release(conn, locked, type);
                    return false;
                }
                locked.add(path);
            }
            return true;
        } catch (SQLException e) {
            try {
                release(conn, locked, type);
            } catch (SQLException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new LockException("Failed to acquire " + type + " lock in domain `" + domain + "`.", e);
        }
    }

    private boolean doSingleLock(Connection conn, String key, LockType type) throws SQLException {
        boolean shared = type == LockType.SHARED;

        try {
            update(conn, shared ? insertShared : insertExclusive, key);
        } catch (SQLException e) {
            if (isDuplicateKey(e)) {
                // 排他锁已被其他会话持有
                return false;
            }
            throw e;
        }

        String delete = shared ? deleteShared : deleteExclusive;
        try {
            if (count(conn, shared ? countExclusive : countShared, key) == 0) {
                return true;
            }
        } catch (SQLException e) {
            try {
                update(conn, delete, key);
            } catch (SQLException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }

        update(conn, delete, key);
        return false;
    }

    @Override
    protected boolean doUnlock(List<String> paths, LockType type) {
        try {
            release(connection.getConnection(), paths, type);
            return true;
        } catch (SQLException e) {
            logger.warn("Failed to release {} locks on {} in domain `{}`.", type, paths, domain, e);
            return false;
        }
    }

    private void release(Connection conn, List<String> paths, LockType type) throws SQLException {
        String sql = type == LockType.SHARED ? deleteShared : deleteExclusive;
        for (String path : paths) {
            update(conn, sql, sha1Base36(path));
        }
    }

    private Connection getConnectionIfUp() {
        String downKey = DOWN_KEY_PREFIX + domain;
        if (srvCache != null && srvCache.get(downKey) != null) {
            logger.debug("Lock database of domain `{}` is marked down.", domain);
            return null;
        }

        try {
            return connection.getConnection();
        } catch (SQLException e) {
            logger.warn("Cannot connect to lock database of domain `{}`.", domain, e);
            if (srvCache != null) {
                srvCache.set(downKey, Boolean.TRUE, safeDelaySeconds, TimeUnit.SECONDS);
            }
            return null;
        }
    }

    private void update(Connection conn, String sql, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            stmt.setString(2, session.getValue());
            stmt.executeUpdate();
        }
    }

    private long count(Connection conn, String sql, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            stmt.setString(2, session.getValue());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    private static boolean isDuplicateKey(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }
}
