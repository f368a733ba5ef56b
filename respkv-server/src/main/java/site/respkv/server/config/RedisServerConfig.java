package site.respkv.server.config;

import lombok.Builder;
import lombok.Data;
import site.respkv.aof.writer.AofSyncPolicy;

/**
 * 服务器配置类，统一管理网络、线程和持久化参数。
 *
 * <p>使用Builder创建，未设置的字段取默认值；启动前调用 {@link #validate()}。
 *
 * @author respkv
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <p>127.0.0.1 仅本机访问，0.0.0.0 允许所有网络访问。
     */
    @Builder.Default
    private String host = "127.0.0.1";

    /**
     * 服务器监听端口，0表示由系统分配临时端口。
     */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** 接受连接的线程数 */
    @Builder.Default
    private int bossThreadCount = 1;

    /** 网络IO线程数 */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行线程数。
     *
     * <p>每个连接固定绑定到一个执行线程，同一连接上的命令按到达顺序执行。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 持久化配置 ==========

    /** 是否启用AOF持久化 */
    @Builder.Default
    private boolean aofEnabled = true;

    /** AOF文件路径 */
    @Builder.Default
    private String aofFileName = "redis.aof";

    /** 刷盘策略，对应 appendfsync always|everysec|no */
    @Builder.Default
    private AofSyncPolicy appendFsync = AofSyncPolicy.EVERYSEC;

    /** EVERYSEC 模式的刷盘间隔（毫秒） */
    @Builder.Default
    private long aofFlushIntervalMs = 1000L;

    /**
     * 加载时发现末尾记录不完整（写到一半时崩溃）是否截断后继续启动，
     * 关闭时直接启动失败。
     */
    @Builder.Default
    private boolean aofLoadTruncated = true;

    /**
     * 创建默认配置。
     *
     * @return 默认配置
     */
    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 校验配置参数
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (aofEnabled) {
            if (aofFileName == null || aofFileName.trim().isEmpty()) {
                throw new IllegalArgumentException("启用AOF时必须指定AOF文件名");
            }
            if (appendFsync == null) {
                throw new IllegalArgumentException("启用AOF时必须指定刷盘策略");
            }
            if (aofFlushIntervalMs <= 0) {
                throw new IllegalArgumentException("AOF刷盘间隔必须大于0");
            }
        }
    }
}
