package site.respkv.database;

import lombok.Getter;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisString;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 键空间容器
 *
 * <p>字符串和哈希分别存放在两个独立的并发映射中，一个键空间上的操作不会阻塞另一个。
 * 两者在 KEYS 枚举和类型检查时视为同一个命名空间，由 {@code RedisCoreImpl} 负责协调。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class RedisDB {

    /** 字符串键空间 */
    private final ConcurrentMap<RedisBytes, RedisString> strings = new ConcurrentHashMap<>();

    /** 哈希键空间 */
    private final ConcurrentMap<RedisBytes, RedisHash> hashes = new ConcurrentHashMap<>();

    /**
     * 条目数量，包含尚未被惰性删除的过期字符串
     *
     * @return 条目数量
     */
    public long size() {
        return (long) strings.size() + hashes.size();
    }

    /**
     * 清空两个键空间
     */
    public void clear() {
        strings.clear();
        hashes.clear();
    }
}
