package cn.zcn.lockmanager.redis;

import cn.zcn.lockmanager.AbstractLockManager;
import cn.zcn.lockmanager.LockManagerSettings;
import cn.zcn.lockmanager.LockType;
import cn.zcn.lockmanager.exception.ConfigException;
import cn.zcn.lockmanager.redis.jedis.JedisPoolExecutor;
import cn.zcn.lockmanager.redis.lettuce.LettuceExecutor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 基于多台 Redis 的法定人数锁管理器，超过半数的服务器同意才算加锁成功。
 * <p>
 * 每个路径在每台服务器上对应一个哈希：
 * <pre>
 * "filelock:{sha1 of path}" = {
 *     "{SH|EX}:{session}" = {expire at, millis}
 * }
 * </pre>
 * 持有的锁每隔 lockTTL / 3 续期一次。
 */
public class RedisLockManager extends AbstractLockManager {

    public static final String LOCK_SERVERS = "lockServers";
    public static final String REDIS_CONFIG = "redisConfig";
    public static final String LOCK_TTL = "lockTTL";

    private static final String KEY_PREFIX = "filelock:";
    private static final long DEFAULT_LOCK_TTL = 30;
    private static final int DEFAULT_PORT = 6379;
    private static final int DEFAULT_TIMEOUT = 2000;

    /**
     * KEYS: 锁键；ARGV: 锁类型, 会话, 当前时间, 锁时长。全部可加锁时才写入，返回 1；否则返回 0。
     */
    private static final byte[] LOCK_SCRIPT = ("local mine = {[ARGV[1] .. ':' .. ARGV[2]] = true};" +
            "mine['SH:' .. ARGV[2]] = true;" +
            "mine['EX:' .. ARGV[2]] = true;" +
            "local now = tonumber(ARGV[3]);" +
            "for i = 1, #KEYS, 1 do" +
            "    local data = redis.call('hgetall', KEYS[i]);" +
            "    for j = 1, #data, 2 do" +
            "        if tonumber(data[j + 1]) <= now then" +
            "            redis.call('hdel', KEYS[i], data[j]);" +
            "        elseif not mine[data[j]] and (ARGV[1] == 'EX' or string.sub(data[j], 1, 3) == 'EX:') then" +
            "            return 0;" +
            "        end;" +
            "    end;" +
            "end;" +
            "local ttl = tonumber(ARGV[4]);" +
            "for i = 1, #KEYS, 1 do" +
            "    redis.call('hset', KEYS[i], ARGV[1] .. ':' .. ARGV[2], now + ttl);" +
            "    if redis.call('pttl', KEYS[i]) < ttl then" +
            "        redis.call('pexpire', KEYS[i], ttl);" +
            "    end;" +
            "end;" +
            "return 1;").getBytes(StandardCharsets.UTF_8);

    /**
     * KEYS: 锁键；ARGV: 锁类型, 会话。返回删除的数量。
     */
    private static final byte[] UNLOCK_SCRIPT = ("local count = 0;" +
            "for i = 1, #KEYS, 1 do" +
            "    count = count + redis.call('hdel', KEYS[i], ARGV[1] .. ':' .. ARGV[2]);" +
            "end;" +
            "return count;").getBytes(StandardCharsets.UTF_8);

    /**
     * KEYS: 锁键；ARGV: 锁类型, 会话, 当前时间, 锁时长。返回续期的数量。
     */
    private static final byte[] RENEW_SCRIPT = ("local count = 0;" +
            "local field = ARGV[1] .. ':' .. ARGV[2];" +
            "local ttl = tonumber(ARGV[4]);" +
            "for i = 1, #KEYS, 1 do" +
            "    if redis.call('hexists', KEYS[i], field) == 1 then" +
            "        redis.call('hset', KEYS[i], field, tonumber(ARGV[3]) + ttl);" +
            "        if redis.call('pttl', KEYS[i]) < ttl then" +
            "            redis.call('pexpire', KEYS[i], ttl);" +
            "        end;" +
            "        count = count + 1;" +
            "    end;" +
            "end;" +
            "return count;").getBytes(StandardCharsets.UTF_8);

    private final Map<String, RedisExecutor> servers;
    private final Timer timer;
    private final boolean ownsTimer;
    private final long lockTtlMillis;

    /**
     * 续期的锁键
     */
    private final Map<LockType, Set<String>> renewKeys = new EnumMap<>(LockType.class);
    private Timeout renewTimeout;

    public RedisLockManager(LockManagerSettings settings) {
        this(settings, createExecutors(settings), new HashedWheelTimer(10, TimeUnit.MILLISECONDS), true);
    }

    RedisLockManager(LockManagerSettings settings, Map<String, RedisExecutor> servers, Timer timer) {
        this(settings, servers, timer, false);
    }

    /**
     * 服务器连接由本实例接管，构造失败或 {@link #close()} 时停止；计时器只在 {@code ownsTimer} 时停止。
     */
    private RedisLockManager(LockManagerSettings settings, Map<String, RedisExecutor> servers, Timer timer, boolean ownsTimer) {
        super(settings);

        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        this.timer = timer;
        this.ownsTimer = ownsTimer;

        try {
            if (servers.isEmpty()) {
                throw new ConfigException("Setting `" + LOCK_SERVERS + "` of lock manager `" + settings.getName() + "` is empty.");
            }
            this.lockTtlMillis = TimeUnit.SECONDS.toMillis(settings.getLong(LOCK_TTL, DEFAULT_LOCK_TTL));
            if (lockTtlMillis <= 0) {
                throw new ConfigException("Setting `" + LOCK_TTL + "` must be positive.");
            }
        } catch (RuntimeException e) {
            stopResources();
            throw e;
        }

        for (LockType type : LockType.values()) {
            renewKeys.put(type, new HashSet<>());
        }
    }

    private static Map<String, RedisExecutor> createExecutors(LockManagerSettings settings) {
        Map<String, Object> lockServers = settings.getMap(LOCK_SERVERS);
        if (lockServers.isEmpty()) {
            throw new ConfigException("Missing required setting `" + LOCK_SERVERS + "` for lock manager `" + settings.getName() + "`.");
        }

        Map<String, Object> redisConfig = settings.getMap(REDIS_CONFIG);
        String client = String.valueOf(redisConfig.getOrDefault("client", "jedis"));
        Object password = redisConfig.get("password");
        int timeout = redisConfig.get("connectTimeout") instanceof Number
                ? ((Number) redisConfig.get("connectTimeout")).intValue()
                : DEFAULT_TIMEOUT;

        Map<String, RedisExecutor> executors = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Object> e : lockServers.entrySet()) {
                String address = String.valueOf(e.getValue());
                int idx = address.lastIndexOf(':');
                String host = idx < 0 ? address : address.substring(0, idx);
                int port = idx < 0 ? DEFAULT_PORT : Integer.parseInt(address.substring(idx + 1));

                if ("lettuce".equalsIgnoreCase(client)) {
                    RedisURI.Builder builder = RedisURI.Builder.redis(host, port).withTimeout(Duration.ofMillis(timeout));
                    if (password != null) {
                        builder.withPassword(String.valueOf(password).toCharArray());
                    }
                    executors.put(e.getKey(), new LettuceExecutor(RedisClient.create(builder.build())));
                } else if ("jedis".equalsIgnoreCase(client)) {
                    JedisPool pool = new JedisPool(new JedisPoolConfig(), host, port, timeout,
                            password == null ? null : String.valueOf(password));
                    executors.put(e.getKey(), new JedisPoolExecutor(pool));
                } else {
                    throw new ConfigException("Unknown redis client `" + client + "`.");
                }
            }
        } catch (NumberFormatException e) {
            executors.values().forEach(RedisExecutor::stop);
            throw new ConfigException("Invalid address in `" + LOCK_SERVERS + "`.", e);
        } catch (RuntimeException e) {
            executors.values().forEach(RedisExecutor::stop);
            throw e;
        }

        return executors;
    }

    @Override
    protected synchronized boolean doLock(List<String> paths, LockType type) {
        List<byte[]> keys = toKeys(paths);
        List<byte[]> args = args(type, true);

        List<RedisExecutor> granted = new ArrayList<>();
        for (Map.Entry<String, RedisExecutor> e : servers.entrySet()) {
            try {
                if (isTrue(e.getValue().eval(LOCK_SCRIPT, keys, args))) {
                    granted.add(e.getValue());
                }
            } catch (RuntimeException ex) {
                logger.warn("Lock server `{}` failed to acquire {} lock.", e.getKey(), type, ex);
            }
        }

        if (granted.size() > servers.size() / 2) {
            for (String path : paths) {
                renewKeys.get(type).add(KEY_PREFIX + sha1Base36(path));
            }
            scheduleRenew();
            return true;
        }

        List<byte[]> unlockArgs = args(type, false);
        for (RedisExecutor server : granted) {
            try {
                server.eval(UNLOCK_SCRIPT, keys, unlockArgs);
            } catch (RuntimeException ex) {
                logger.warn("Failed to roll back {} lock, it will expire in {} ms.", type, lockTtlMillis, ex);
            }
        }
        return false;
    }

    @Override
    protected synchronized boolean doUnlock(List<String> paths, LockType type) {
        for (String path : paths) {
            renewKeys.get(type).remove(KEY_PREFIX + sha1Base36(path));
        }

        List<byte[]> keys = toKeys(paths);
        List<byte[]> args = args(type, false);
        int released = 0;

        for (Map.Entry<String, RedisExecutor> e : servers.entrySet()) {
            try {
                e.getValue().eval(UNLOCK_SCRIPT, keys, args);
                released++;
            } catch (RuntimeException ex) {
                logger.warn("Lock server `{}` failed to release {} lock.", e.getKey(), type, ex);
            }
        }

        return released > servers.size() / 2;
    }

    private void scheduleRenew() {
        if (renewTimeout != null) {
            return;
        }

        renewTimeout = timer.newTimeout(this::renew, lockTtlMillis / 3, TimeUnit.MILLISECONDS);
    }

    synchronized void renew(Timeout timeout) {
        if (renewTimeout != timeout) {
            return;
        }
        renewTimeout = null;

        boolean held = false;

        for (Map.Entry<LockType, Set<String>> e : renewKeys.entrySet()) {
            if (e.getValue().isEmpty()) {
                continue;
            }
            held = true;

            List<byte[]> keys = new ArrayList<>();
            for (String key : e.getValue()) {
                keys.add(key.getBytes(StandardCharsets.UTF_8));
            }

            List<byte[]> args = args(e.getKey(), true);
            for (Map.Entry<String, RedisExecutor> server : servers.entrySet()) {
                try {
                    server.getValue().eval(RENEW_SCRIPT, keys, args);
                } catch (RuntimeException ex) {
                    logger.warn("Lock server `{}` failed to renew {} locks.", server.getKey(), e.getKey(), ex);
                }
            }
        }

        if (held) {
            scheduleRenew();
        }
    }

    private List<byte[]> toKeys(List<String> paths) {
        List<byte[]> keys = new ArrayList<>(paths.size());
        for (String path : paths) {
            keys.add((KEY_PREFIX + sha1Base36(path)).getBytes(StandardCharsets.UTF_8));
        }
        return keys;
    }

    private List<byte[]> args(LockType type, boolean withTtl) {
        String typeName = type == LockType.SHARED ? "SH" : "EX";
        if (!withTtl) {
            return Arrays.asList(typeName.getBytes(StandardCharsets.UTF_8), session.getValue().getBytes(StandardCharsets.UTF_8));
        }
        return Arrays.asList(typeName.getBytes(StandardCharsets.UTF_8),
                session.getValue().getBytes(StandardCharsets.UTF_8),
                String.valueOf(System.currentTimeMillis()).getBytes(StandardCharsets.UTF_8),
                String.valueOf(lockTtlMillis).getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isTrue(Object result) {
        return result instanceof Number && ((Number) result).longValue() == 1L;
    }

    @Override
    public synchronized void close() {
        if (renewTimeout != null) {
            renewTimeout.cancel();
            renewTimeout = null;
        }
        stopResources();
    }

    private void stopResources() {
        if (ownsTimer) {
            timer.stop();
        }
        for (RedisExecutor server : servers.values()) {
            server.stop();
        }
    }
}
