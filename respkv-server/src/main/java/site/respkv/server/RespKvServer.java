package site.respkv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.extern.slf4j.Slf4j;
import site.respkv.core.RedisCoreImpl;
import site.respkv.protocol.handler.RespDecoder;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.server.config.RedisServerConfig;
import site.respkv.server.context.RedisContext;
import site.respkv.server.context.RedisContextImpl;
import site.respkv.server.handler.RespCommandHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;

/**
 * 基于Netty的服务器实现
 *
 * <p>线程模型：boss线程组接受连接，worker线程组负责编解码，命令在独立的
 * {@link DefaultEventExecutorGroup} 中执行。每个连接固定绑定一个执行线程，
 * 同一连接上的命令按到达顺序执行并回复。
 *
 * <p>启动顺序：打开AOF → 重放 → 绑定端口。重放完成前不接受任何连接。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespKvServer implements RedisServer {

    /** 服务器配置 */
    private final RedisServerConfig config;

    /** 服务器Channel类型，根据操作系统自动选择 */
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private Channel serverChannel;

    /** 服务器上下文 */
    private final RedisContext redisContext;

    /**
     * 按配置创建服务器，打开（或创建）AOF文件
     *
     * @param config 服务器配置
     * @throws IOException 打开AOF文件失败
     * @throws IllegalArgumentException 配置无效
     */
    public RespKvServer(final RedisServerConfig config) throws IOException {
        config.validate();
        this.config = config;
        this.redisContext = new RedisContextImpl(new RedisCoreImpl(), config);

        initializeEventLoopGroups();
        initializeCommandExecutor();
    }

    @Override
    public void start() {
        try {
            redisContext.loadAof();
        } catch (IOException e) {
            stop();
            throw new UncheckedIOException("读取AOF文件失败: " + config.getAofFileName(), e);
        } catch (RuntimeException e) {
            stop();
            throw e;
        }

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(redisContext));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("服务器已启动，监听 {}:{}", config.getHost(), getPort());
        } catch (InterruptedException e) {
            stop();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("服务器启动被中断", e);
        } catch (Exception e) {
            log.error("绑定端口失败 {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IllegalStateException("绑定端口失败: " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    @Override
    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
        } catch (InterruptedException e) {
            log.error("停止服务器时被中断", e);
            Thread.currentThread().interrupt();
        } finally {
            redisContext.shutdown();
        }
        log.info("服务器已停止");
    }

    @Override
    public int getPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("服务器未启动");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public RedisContext getRedisContext() {
        return redisContext;
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("respkv-cmd"));
    }
}
