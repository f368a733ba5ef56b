package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * Redis数组类型
 *
 * <p>元素可以是任意RESP值，允许嵌套。命令帧总是由批量字符串组成的数组，
 * 元素0为命令名。
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespArray extends Resp {
    /** null数组的RESP编码 */
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();

    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    public static final RespArray NULL = new RespArray((Resp[]) null);

    /** 数组内容，null表示null数组 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    /**
     * 工厂方法：空数组和null数组返回缓存实例
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /**
     * 由字符串构造命令帧，测试和重放工具使用
     *
     * @param parts 命令名及参数
     * @return 批量字符串数组
     */
    public static RespArray ofCommand(final String... parts) {
        final Resp[] content = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            content[i] = BulkString.fromString(parts[i]);
        }
        return valueOf(content);
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * 元素数，null数组返回-1
     */
    public int size() {
        return content == null ? -1 : content.length;
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    /**
     * 将 RespArray 编码到 ByteBuf
     *
     * @param byteBuf 写入编码数据的目标缓冲区
     */
    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        byteBuf.writeByte('*');
        writeLongAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public RespArray asArray() {
        return this;
    }

    @Override
    public String toString() {
        return content == null ? "(nil)" : Arrays.toString(content);
    }
}
