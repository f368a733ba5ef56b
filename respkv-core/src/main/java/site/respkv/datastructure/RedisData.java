package site.respkv.datastructure;

/**
 * 数据结构基础接口
 *
 * <p>所有存放在键空间中的值都实现此接口，统一过期时间的表示。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface RedisData {

    /**
     * 获取数据过期时间
     *
     * @return 过期时间戳（毫秒），-1表示永不过期
     */
    long timeout();

    /**
     * 判断在给定时刻是否已过期
     *
     * @param nowMillis 当前时间戳（毫秒）
     * @return 设置了过期时间且已到达返回true
     */
    default boolean isExpired(final long nowMillis) {
        final long timeout = timeout();
        return timeout != -1 && timeout <= nowMillis;
    }
}
