package cn.zcn.lockmanager.redis.lettuce;

import cn.zcn.lockmanager.redis.RedisExecutor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.ByteArrayCodec;

import java.nio.charset.StandardCharsets;
import java.util.List;

public class LettuceExecutor implements RedisExecutor {

    private final RedisClient redisClient;
    private final StatefulRedisConnection<byte[], byte[]> conn;
    private final RedisCommands<byte[], byte[]> commands;

    public LettuceExecutor(RedisClient redisClient) {
        this.redisClient = redisClient;
        try {
            this.conn = redisClient.connect(ByteArrayCodec.INSTANCE);
        } catch (RuntimeException e) {
            redisClient.shutdown();
            throw e;
        }
        this.commands = this.conn.sync();
    }

    @Override
    public Object eval(byte[] script, List<byte[]> keys, List<byte[]> args) {
        return commands.eval(new String(script, StandardCharsets.UTF_8), ScriptOutputType.INTEGER,
                keys.toArray(new byte[0][]), args.toArray(new byte[0][]));
    }

    @Override
    public void stop() {
        if (conn.isOpen()) {
            conn.close();
        }

        redisClient.shutdown();
    }
}
