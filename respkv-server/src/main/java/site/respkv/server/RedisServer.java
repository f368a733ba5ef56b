package site.respkv.server;

import site.respkv.server.context.RedisContext;

/**
 * 服务器接口
 *
 * @author respkv
 * @since 1.0.0
 */
public interface RedisServer {

    /**
     * 启动服务器：重放AOF，然后绑定端口开始接受连接。
     *
     * @throws java.io.UncheckedIOException 读取AOF失败
     * @throws site.respkv.aof.AofLoadException AOF文件损坏
     * @throws IllegalStateException 绑定端口失败
     */
    void start();

    /**
     * 停止服务器：关闭监听和所有连接，停止线程组，AOF最后一次刷盘后关闭。
     */
    void stop();

    /**
     * 实际监听的端口，配置为0时由系统分配
     *
     * @return 端口号
     * @throws IllegalStateException 服务器未启动
     */
    int getPort();

    RedisContext getRedisContext();
}
