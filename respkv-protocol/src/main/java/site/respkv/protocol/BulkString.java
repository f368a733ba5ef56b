package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.respkv.datastructure.RedisBytes;

/**
 * Redis批量字符串类型
 *
 * <p>内容基于 {@link RedisBytes}，按字节计长。内容为null时即数据模型中的Null值，
 * 统一使用 {@link #NULL} 实例，编码为 {@code $-1\r\n}。
 *
 * <p>使用建议：
 * <ul>
 *     <li>优先使用工厂方法而非构造函数</li>
 *     <li>内部解码使用wrapTrusted避免拷贝</li>
 *     <li>外部数据使用create确保安全性</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    /** 空值的RESP编码 */
    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    /** 空字符串的RESP编码 */
    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** Null值 */
    public static final BulkString NULL = new BulkString(null);

    /** 字符串内容的字节表示，null表示Null值 */
    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 创建BulkString的工厂方法：安全模式，复制输入数组
     *
     * @param content 字节数组内容
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        if (content == null) {
            return NULL;
        }
        return new BulkString(new RedisBytes(content));
    }

    /**
     * 基于RedisBytes创建
     *
     * @param content RedisBytes内容
     * @return BulkString实例
     */
    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝工厂方法：用于高性能内部路径
     *
     * <p>警告：调用者必须保证bytes数组不会被修改！仅在解码器等可信代码中使用。</p>
     *
     * @param trustedBytes 受信任的字节数组
     * @return 零拷贝的BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    /**
     * 将 BulkString 编码到 ByteBuf
     *
     * @param byteBuf 写入编码数据的目标缓冲区
     */
    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final byte[] bytes = content.getBytesUnsafe();
        final int length = bytes.length;
        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        byteBuf.ensureWritable(length + 16);
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public BulkString asBulkString() {
        return this;
    }

    @Override
    public RedisBytes asBytes() {
        if (content == null) {
            throw new RespTypeException(RespType.BULK_STRING, RespType.BULK_STRING, "期望非null批量字符串");
        }
        return content;
    }

    @Override
    public String asText() {
        return asBytes().getString();
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，Null值返回 null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
