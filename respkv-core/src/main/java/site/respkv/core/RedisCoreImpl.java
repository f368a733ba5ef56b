package site.respkv.core;

import lombok.extern.slf4j.Slf4j;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisString;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 数据引擎实现
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li><strong>键空间</strong>：两个独立的ConcurrentHashMap，单键操作由映射自身保证原子性</li>
 *     <li><strong>惰性过期</strong>：读到过期条目时用 {@code remove(key, entry)} 条件删除，并发写入的新值不会丢失</li>
 *     <li><strong>哈希创建</strong>：{@code computeIfAbsent} 保证两个线程同时写入新哈希时只创建一次</li>
 * </ul>
 *
 * <p>跨键空间的类型检查是尽力而为的：同名键上的 SET 与 HSET 并发执行时，
 * 两个映射之间没有统一的锁。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RedisCoreImpl implements RedisCore {

    private static final String TYPE_STRING = "string";
    private static final String TYPE_HASH = "hash";
    private static final String TYPE_NONE = "none";

    private final RedisDB db;

    /** 过期判断使用的时钟 */
    private final Clock clock;

    public RedisCoreImpl() {
        this(Clock.systemUTC());
    }

    public RedisCoreImpl(final Clock clock) {
        this.clock = clock;
        this.db = new RedisDB();
    }

    @Override
    public void setString(final RedisBytes key, final RedisBytes value, final long expireAtMillis) {
        db.getStrings().put(key, new RedisString(value, expireAtMillis));
        if (db.getHashes().remove(key) != null) {
            log.debug("SET覆盖了同名哈希: {}", key);
        }
    }

    @Override
    public RedisBytes getString(final RedisBytes key) {
        final RedisString entry = liveString(key);
        if (entry == null) {
            if (db.getHashes().containsKey(key)) {
                throw new WrongTypeException();
            }
            return null;
        }
        return entry.getValue();
    }

    @Override
    public boolean hset(final RedisBytes key, final RedisBytes field, final RedisBytes value) {
        if (liveString(key) != null) {
            throw new WrongTypeException();
        }
        final RedisHash hash = db.getHashes().computeIfAbsent(key, k -> new RedisHash());
        return hash.put(field, value);
    }

    @Override
    public RedisBytes hget(final RedisBytes key, final RedisBytes field) {
        final RedisHash hash = db.getHashes().get(key);
        if (hash == null) {
            if (liveString(key) != null) {
                throw new WrongTypeException();
            }
            return null;
        }
        return hash.get(field);
    }

    @Override
    public List<RedisBytes> keys(final RedisBytes pattern) {
        if (!pattern.endsWith('*')) {
            final List<RedisBytes> result = new ArrayList<>(1);
            if (exists(pattern)) {
                result.add(pattern);
            }
            return result;
        }

        final RedisBytes prefix = pattern.head(pattern.length() - 1);
        final long now = clock.millis();
        final Set<RedisBytes> result = new LinkedHashSet<>();
        for (final Map.Entry<RedisBytes, RedisString> entry : db.getStrings().entrySet()) {
            if (entry.getValue().isExpired(now)) {
                db.getStrings().remove(entry.getKey(), entry.getValue());
                continue;
            }
            if (entry.getKey().startsWith(prefix)) {
                result.add(entry.getKey());
            }
        }
        for (final RedisBytes name : db.getHashes().keySet()) {
            if (name.startsWith(prefix)) {
                result.add(name);
            }
        }
        return new ArrayList<>(result);
    }

    @Override
    public boolean exists(final RedisBytes key) {
        return liveString(key) != null || db.getHashes().containsKey(key);
    }

    @Override
    public String type(final RedisBytes key) {
        if (liveString(key) != null) {
            return TYPE_STRING;
        }
        return db.getHashes().containsKey(key) ? TYPE_HASH : TYPE_NONE;
    }

    @Override
    public long size() {
        return db.size();
    }

    @Override
    public void flushAll() {
        db.clear();
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * 读取未过期的字符串条目，过期条目在此删除
     */
    private RedisString liveString(final RedisBytes key) {
        final RedisString entry = db.getStrings().get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            db.getStrings().remove(key, entry);
            log.debug("键已过期，惰性删除: {}", key);
            return null;
        }
        return entry;
    }
}
