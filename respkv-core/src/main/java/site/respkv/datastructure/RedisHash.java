package site.respkv.datastructure;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 哈希条目：字段到值的并发映射
 *
 * <p>每个哈希有独立的内部映射，不同哈希之间的字段更新互不竞争。
 * 允许存在零个字段的哈希。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RedisHash implements RedisData {

    private final Map<RedisBytes, RedisBytes> fields = new ConcurrentHashMap<>();

    /**
     * 写入字段
     *
     * @param field 字段名
     * @param value 值
     * @return 新字段返回true，覆盖已有字段返回false
     */
    public boolean put(final RedisBytes field, final RedisBytes value) {
        return fields.put(field, value) == null;
    }

    public RedisBytes get(final RedisBytes field) {
        return fields.get(field);
    }

    public int size() {
        return fields.size();
    }

    /** 哈希不支持过期 */
    @Override
    public long timeout() {
        return -1;
    }
}
