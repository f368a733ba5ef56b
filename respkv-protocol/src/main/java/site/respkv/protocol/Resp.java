package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;
import site.respkv.datastructure.RedisBytes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议基础类
 *
 * <p>所有RESP值类型的基类，定义统一的编码接口、类型化访问器以及帧解码入口。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头，64位有符号</li>
 *     <li>批量字符串 - 以"$"开头，长度-1表示null</li>
 *     <li>数组 - 以"*"开头，元素数-1表示null</li>
 * </ul>
 *
 * <p>解码约定：数据不完整时返回null并恢复读索引；数据格式错误时抛出
 * {@link RespProtocolException}，同样恢复读索引。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    protected static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    /** 批量字符串最大长度 512MB */
    public static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;

    /** 数组最大元素数 */
    public static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    /** 数组最大嵌套层数 */
    public static final int PROTO_MAX_NESTING = 32;

    /** 未找到行结束符时允许的最大行长度 */
    public static final int PROTO_MAX_LINE_LEN = 64 * 1024;

    /** 数组预分配的最大元素数，更多的元素随到达扩容 */
    private static final int MAX_PREALLOCATED_ELEMENTS = 64;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入整数的十进制表示，小整数走缓存
     *
     * @param buf 目标缓冲区
     * @param value 整数值
     */
    protected static void writeLongAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * RESP 协议解码方法
     * 支持的类型：
     * - SimpleString "+OK\r\n"
     * - Errors "-Error message\r\n"
     * - RespInteger ":0\r\n"
     * - BulkString "$6\r\nfoobar\r\n"
     * - RespArray "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"
     *
     * @param buffer 输入缓冲区
     * @return 解码后的 Resp 对象，如果数据不完整返回null
     * @throws RespProtocolException 当数据格式不符合RESP协议规范时
     */
    public static Resp decode(final ByteBuf buffer) {
        if (buffer.readableBytes() <= 0) {
            return null;
        }
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeFrame(buffer, 0);
        } catch (IllegalStateException e) {
            // 数据不完整，回滚读索引等待更多数据
            buffer.readerIndex(initialIndex);
            return null;
        } catch (RespProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    /**
     * 解码一帧，数据不足时抛出IllegalStateException由外层回滚
     */
    private static Resp decodeFrame(final ByteBuf buffer, final int depth) {
        if (buffer.readableBytes() <= 0) {
            throw new IllegalStateException("数据不完整：缺少类型标识");
        }
        final byte typeIndicator = buffer.readByte();
        final RespType type = RespType.fromMarker(typeIndicator);
        if (type == null) {
            log.warn("无法识别的RESP类型标识: '{}' (字节值: {})", (char) typeIndicator, typeIndicator & 0xFF);
            throw new RespProtocolException("unknown type marker '" + (char) typeIndicator + "'");
        }

        switch (type) {
            case SIMPLE_STRING:
                return SimpleString.valueOf(new String(readLine(buffer), StandardCharsets.UTF_8));
            case ERROR:
                return new Errors(new String(readLine(buffer), StandardCharsets.UTF_8));
            case INTEGER:
                return RespInteger.valueOf(parseLong(readLine(buffer)));
            case BULK_STRING:
                return decodeBulkString(buffer);
            case ARRAY:
                return decodeArray(buffer, depth);
            default:
                throw new RespProtocolException("unknown type marker '" + (char) typeIndicator + "'");
        }
    }

    private static BulkString decodeBulkString(final ByteBuf buffer) {
        final long length = parseLong(readLine(buffer));
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < -1 || length > PROTO_MAX_BULK_LEN) {
            throw new RespProtocolException("invalid bulk length " + length);
        }
        final int size = (int) length;
        if (buffer.readableBytes() < size + 2) {
            throw new IllegalStateException("数据不完整：BulkString内容长度不足");
        }
        final byte[] content = new byte[size];
        buffer.readBytes(content);
        // 结尾的两个字节直接丢弃，不校验内容
        buffer.skipBytes(2);
        return BulkString.wrapTrusted(content);
    }

    private static RespArray decodeArray(final ByteBuf buffer, final int depth) {
        final long count = parseLong(readLine(buffer));
        if (count == -1) {
            return RespArray.NULL;
        }
        if (count < -1 || count > PROTO_MAX_ARRAY_LEN) {
            throw new RespProtocolException("invalid multibulk length " + count);
        }
        if (count == 0) {
            return RespArray.EMPTY;
        }
        if (depth >= PROTO_MAX_NESTING) {
            throw new RespProtocolException("array nesting deeper than " + PROTO_MAX_NESTING);
        }
        // 元素数由对端声明，不按声明值一次性分配
        final List<Resp> elements = new ArrayList<>((int) Math.min(count, MAX_PREALLOCATED_ELEMENTS));
        for (long i = 0; i < count; i++) {
            elements.add(decodeFrame(buffer, depth + 1));
        }
        return new RespArray(elements.toArray(new Resp[0]));
    }

    /**
     * 读取一行直到 \r\n，不含行结束符
     *
     * @param buffer 输入缓冲区
     * @return 行内容
     * @throws IllegalStateException 没有找到完整的行
     */
    static byte[] readLine(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0) {
            if (buffer.readableBytes() > PROTO_MAX_LINE_LEN) {
                throw new RespProtocolException("line too long");
            }
            throw new IllegalStateException("数据不完整：没有找到换行符");
        }
        if (endIndex + 1 >= buffer.writerIndex()) {
            throw new IllegalStateException("数据不完整：缺少\\n");
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new RespProtocolException("expected '\\n' after '\\r'");
        }
        final byte[] line = new byte[endIndex - startIndex];
        buffer.readBytes(line);
        buffer.skipBytes(2);
        return line;
    }

    /**
     * 解析十进制有符号64位整数，不接受前导"+"和空白
     *
     * @param line 数字行
     * @return 解析结果
     * @throws RespProtocolException 非法数字或溢出
     */
    static long parseLong(final byte[] line) {
        if (line.length == 0) {
            throw new RespProtocolException("invalid integer ''");
        }
        final int start = line[0] == '-' ? 1 : 0;
        if (start == line.length) {
            throw new RespProtocolException("invalid integer '-'");
        }
        for (int i = start; i < line.length; i++) {
            if (line[i] < '0' || line[i] > '9') {
                throw new RespProtocolException("invalid integer '"
                        + new String(line, StandardCharsets.UTF_8) + "'");
            }
        }
        final String text = new String(line, StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("integer out of range '" + text + "'", e);
        }
    }

    /**
     * 值的类型标签
     *
     * @return 类型
     */
    public abstract RespType getType();

    /**
     * 将值编码到缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 编码为独立的字节数组
     *
     * @return 线路格式字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encode(buf);
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 以批量字符串访问
     *
     * @return 批量字符串
     * @throws RespTypeException 类型不符
     */
    public BulkString asBulkString() {
        throw new RespTypeException(RespType.BULK_STRING, getType());
    }

    /**
     * 以数组访问
     *
     * @return 数组
     * @throws RespTypeException 类型不符
     */
    public RespArray asArray() {
        throw new RespTypeException(RespType.ARRAY, getType());
    }

    /**
     * 以非null批量字符串的字节内容访问，命令参数走这个入口
     *
     * @return 字节内容
     * @throws RespTypeException 不是批量字符串或为null
     */
    public RedisBytes asBytes() {
        return asBulkString().asBytes();
    }

    /**
     * 以文本访问，批量字符串和简单字符串可用
     *
     * @return 文本内容
     * @throws RespTypeException 类型不符
     */
    public String asText() {
        throw new RespTypeException(RespType.BULK_STRING, getType());
    }
}
