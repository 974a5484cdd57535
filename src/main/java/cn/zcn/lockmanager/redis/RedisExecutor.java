package cn.zcn.lockmanager.redis;

import java.util.List;

/**
 * 单个 Redis 服务器的脚本执行器
 */
public interface RedisExecutor {

    /**
     * 执行 redis lua 脚本
     *
     * @param script lua 脚本
     * @param keys   所用到的 redis 键
     * @param args   所用到的 redis 值
     * @return 脚本运行结果，脚本须返回整数
     */
    Object eval(byte[] script, List<byte[]> keys, List<byte[]> args);

    void stop();
}
