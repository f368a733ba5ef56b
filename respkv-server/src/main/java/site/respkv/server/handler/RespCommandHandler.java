package site.respkv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.Resp;
import site.respkv.protocol.handler.ProtocolErrorEvent;
import site.respkv.server.context.RedisContext;

import java.io.IOException;

/**
 * 命令处理器：每收到一帧请求，交给分发器处理并回复一个值
 *
 * <p>格式错误的帧由 {@code RespDecoder} 转为 {@link ProtocolErrorEvent}，
 * 该事件与请求在同一个执行线程上按到达顺序处理：先回复之前的请求，再回复协议错误并关闭连接。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    /** 服务器上下文 */
    private final RedisContext redisContext;

    /**
     * @param redisContext 服务器上下文
     * @throws IllegalArgumentException 如果redisContext为null
     */
    public RespCommandHandler(final RedisContext redisContext) {
        if (redisContext == null) {
            throw new IllegalArgumentException("Redis上下文不能为null");
        }
        this.redisContext = redisContext;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.debug("客户端连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final Resp response = redisContext.getDispatcher().process(msg);
        if (!ctx.channel().isActive()) {
            log.debug("连接已关闭，丢弃回复");
            return;
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof ProtocolErrorEvent) {
            ctx.writeAndFlush(((ProtocolErrorEvent) evt).toErrors()).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    /**
     * 处理连接异常。对端重置连接属于正常断开，只记录DEBUG。
     *
     * @param ctx 通道上下文
     * @param cause 异常原因
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof IOException) {
            log.debug("连接异常断开: {} ({})", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) {
        log.debug("客户端断开: {}", ctx.channel().remoteAddress());
        ctx.fireChannelInactive();
    }
}
