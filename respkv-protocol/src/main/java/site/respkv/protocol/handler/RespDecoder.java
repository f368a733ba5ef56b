package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespProtocolException;
import site.respkv.protocol.RespType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，支持标准RESP格式和INLINE命令格式
 * （如 {@code PING\r\n}，按空白分割为批量字符串数组）。
 *
 * <p>遇到格式错误的帧时停止读取，丢弃剩余数据，并向下游发出 {@link ProtocolErrorEvent}。
 * 事件排在已解码的请求之后，由命令处理器回复 {@code -ERR Protocol error: ...} 并关闭连接，
 * 此后该连接上的数据不再可信。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 最大内联命令长度限制 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    /** 已发生协议错误，后续数据全部丢弃 */
    private boolean failed;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        while (in.readableBytes() > 0) {
            final byte firstByte = in.getByte(in.readerIndex());

            // 1. 跳过前导的换行符
            if (firstByte == '\n' || firstByte == '\r') {
                in.skipBytes(1);
                continue;
            }

            try {
                // 2. 判断是RESP格式还是INLINE格式
                final Resp resp = RespType.fromMarker(firstByte) != null
                        ? Resp.decode(in)
                        : decodeInlineCommand(in);
                if (resp != null) {
                    out.add(resp);
                    log.debug("成功解码RESP对象: {}", resp.getClass().getSimpleName());
                }
                // 数据不完整或已产出一个消息，交还给父类循环
                return;
            } catch (RespProtocolException e) {
                log.warn("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                failed = true;
                in.skipBytes(in.readableBytes());
                ctx.channel().config().setAutoRead(false);
                ctx.fireUserEventTriggered(new ProtocolErrorEvent(e.getMessage()));
                return;
            }
        }
    }

    /**
     * 解码INLINE格式命令（如：PING\r\n）
     *
     * @param in 输入缓冲区
     * @return 解码后的RESP对象，如果数据不完整返回null
     */
    private Resp decodeInlineCommand(final ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int lineEnd = in.indexOf(startIndex, in.writerIndex(), (byte) '\n');
        if (lineEnd < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                throw new RespProtocolException("too big inline request");
            }
            return null;
        }

        int contentEnd = lineEnd;
        if (contentEnd > startIndex && in.getByte(contentEnd - 1) == '\r') {
            contentEnd--;
        }
        final String commandLine = in.toString(startIndex, contentEnd - startIndex, StandardCharsets.UTF_8);
        in.readerIndex(lineEnd + 1);

        final BulkString[] parts = parseCommandParts(commandLine);
        if (parts.length == 0) {
            return null;
        }
        log.debug("解析INLINE命令: {}", commandLine);
        return new RespArray(parts);
    }

    /**
     * 按空白分割命令行
     *
     * @param commandLine 命令行
     * @return BulkString 数组，空行返回空数组
     */
    static BulkString[] parseCommandParts(final String commandLine) {
        final List<BulkString> parts = new ArrayList<>(8);
        final StringBuilder current = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            final char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    parts.add(BulkString.fromString(current.toString()));
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(BulkString.fromString(current.toString()));
        }
        return parts.toArray(new BulkString[0]);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
