package site.respkv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节串，键、值、字段名以及命令名的统一表示。
 *
 * <p>RESP 的批量字符串按字节计长，所以数据在内存中以字节数组保存，
 * 只在需要文本语义（命令名匹配、日志、模式比较）时才解码为字符串。
 *
 * <p>特性：
 * <ul>
 *   <li>不可变：公开构造函数执行防御性拷贝，{@link #wrapTrusted(byte[])} 仅供解码器等可信路径使用
 *   <li>哈希预计算：作为 {@code ConcurrentHashMap} 的键时避免重复计算
 *   <li>字符串延迟缓存：首次调用 {@link #getString()} 后缓存结果
 * </ul>
 *
 * <p>线程安全性：实例不可变，可在线程间自由共享。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    /** 字符串编解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 预分配的空字节串 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    /** 底层字节数组（不可修改） */
    private final byte[] bytes;

    /** 预计算的哈希值 */
    private final int hashCode;

    /** 延迟初始化的字符串值 */
    private volatile String stringValue;

    /**
     * 创建字节串，复制入参数组。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝工厂方法。
     *
     * <p><b>警告</b>：调用者必须保证数组此后不再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 从字符串创建字节串（UTF-8）。
     *
     * @param str 源字符串
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 获取底层数组的副本。
     *
     * @return 字节数组副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用者不得修改返回的数组。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取字符串表示（UTF-8 解码，结果缓存）。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 判断是否以给定前缀开头，逐字节比较。
     *
     * @param prefix 前缀
     * @return 以prefix开头返回true
     */
    public boolean startsWith(final RedisBytes prefix) {
        final byte[] other = prefix.bytes;
        if (other.length > bytes.length) {
            return false;
        }
        for (int i = 0; i < other.length; i++) {
            if (bytes[i] != other[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * 判断最后一个字节是否为给定字符。
     *
     * @param c ASCII字符
     * @return 末字节等于c返回true
     */
    public boolean endsWith(final char c) {
        return bytes.length > 0 && bytes[bytes.length - 1] == (byte) c;
    }

    /**
     * 截取前 {@code length} 个字节。
     *
     * @param length 新长度
     * @return 新的字节串
     */
    public RedisBytes head(final int length) {
        if (length == bytes.length) {
            return this;
        }
        return new RedisBytes(Arrays.copyOf(bytes, length), true);
    }

    /**
     * 大小写不敏感比较，仅折叠ASCII字母。
     *
     * @param other 另一个字节串
     * @return 忽略大小写后相等返回true
     */
    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.bytes.length != bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            byte a = bytes[i];
            byte b = other.bytes[i];
            if (a == b) {
                continue;
            }
            if (a >= 'A' && a <= 'Z') {
                a += 32;
            }
            if (b >= 'A' && b <= 'Z') {
                b += 32;
            }
            if (a != b) {
                return false;
            }
        }
        return true;
    }

    /**
     * 字节长度
     *
     * @return 长度
     */
    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public int compareTo(final RedisBytes other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 返回字符串内容，便于日志与断言。
     */
    @Override
    public String toString() {
        return getString();
    }
}
