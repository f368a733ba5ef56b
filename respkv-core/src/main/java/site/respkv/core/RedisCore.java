package site.respkv.core;

import site.respkv.datastructure.RedisBytes;

import java.util.List;

/**
 * 数据引擎接口
 *
 * <p>持有字符串和哈希两个键空间，提供命令处理器需要的全部读写操作。
 * 过期采用惰性策略：只在读取时检查并删除，没有后台清理。
 *
 * <p>所有实现必须是线程安全的，不同键上的操作可以完全并行。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface RedisCore {

    /**
     * 写入字符串，覆盖旧值及其过期时间。同名哈希会被删除。
     *
     * @param key 键
     * @param value 值
     * @param expireAtMillis 过期时间戳（毫秒），-1表示永不过期
     */
    void setString(RedisBytes key, RedisBytes value, long expireAtMillis);

    /**
     * 读取字符串，已过期的条目在本次读取时删除
     *
     * @param key 键
     * @return 值，不存在或已过期返回null
     * @throws WrongTypeException 键持有哈希
     */
    RedisBytes getString(RedisBytes key);

    /**
     * 写入哈希字段，哈希不存在时原子地创建
     *
     * @return 新字段返回true
     * @throws WrongTypeException 键持有字符串
     */
    boolean hset(RedisBytes key, RedisBytes field, RedisBytes value);

    /**
     * @return 字段值，哈希或字段不存在返回null
     * @throws WrongTypeException 键持有字符串
     */
    RedisBytes hget(RedisBytes key, RedisBytes field);

    /**
     * 按模式列出键。以 {@code *} 结尾表示前缀匹配，否则为精确存在性检查。
     * 同时覆盖两个键空间，跳过并删除已过期的字符串，每个名字只出现一次。
     *
     * @param pattern 模式
     * @return 匹配的键，顺序不保证
     */
    List<RedisBytes> keys(RedisBytes pattern);

    boolean exists(RedisBytes key);

    /**
     * @return "string"、"hash" 或 "none"
     */
    String type(RedisBytes key);

    /**
     * @return 条目数量，包含尚未被惰性删除的过期字符串
     */
    long size();

    void flushAll();

    /**
     * 引擎时钟的当前时间，过期时间基于此计算
     *
     * @return 毫秒时间戳
     */
    long currentTimeMillis();
}
