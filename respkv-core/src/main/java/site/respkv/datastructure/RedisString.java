package site.respkv.datastructure;

import lombok.Getter;

/**
 * 字符串条目
 *
 * <p>不可变：SET 总是放入新实例，所以旧值的过期时间随之失效，
 * 惰性删除时按实例做条件删除即可避免误删并发写入的新值。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public final class RedisString implements RedisData {

    /** 字符串值 */
    private final RedisBytes value;

    /** 过期时间戳（毫秒），-1表示永不过期 */
    private final long timeout;

    public RedisString(final RedisBytes value) {
        this(value, -1);
    }

    public RedisString(final RedisBytes value, final long timeout) {
        this.value = value;
        this.timeout = timeout;
    }

    @Override
    public long timeout() {
        return timeout;
    }
}
