package site.respkv.server.context;

import lombok.extern.slf4j.Slf4j;
import site.respkv.aof.AofManager;
import site.respkv.command.CommandDispatcher;
import site.respkv.core.RedisCore;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.RespArray;
import site.respkv.server.command.executor.CommandExecutorImpl;
import site.respkv.server.config.RedisServerConfig;

import java.io.IOException;
import java.util.List;

/**
 * 服务器上下文实现
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RedisContextImpl implements RedisContext {

    private final RedisCore redisCore;
    private final AofManager aofManager;
    private final CommandDispatcher dispatcher;

    private volatile boolean shutdown;

    /**
     * 按配置创建上下文，启用AOF时打开（或创建）AOF文件
     *
     * @param redisCore 数据引擎
     * @param config 服务器配置
     * @throws IOException 打开AOF文件失败
     */
    public RedisContextImpl(final RedisCore redisCore, final RedisServerConfig config) throws IOException {
        this(redisCore, config.isAofEnabled()
                ? new AofManager(config.getAofFileName(), config.getAppendFsync(),
                        config.getAofFlushIntervalMs(), config.isAofLoadTruncated())
                : null);
    }

    /**
     * @param redisCore 数据引擎
     * @param aofManager AOF管理器，null表示不启用持久化
     */
    public RedisContextImpl(final RedisCore redisCore, final AofManager aofManager) {
        this.redisCore = redisCore;
        this.aofManager = aofManager;
        this.dispatcher = new CommandDispatcher(this);
        log.info("RedisContext初始化完成，AOF: {}", aofManager != null ? "启用" : "关闭");
    }

    // ========== 数据操作 ==========

    @Override
    public void setString(final RedisBytes key, final RedisBytes value, final long expireAtMillis) {
        redisCore.setString(key, value, expireAtMillis);
    }

    @Override
    public RedisBytes getString(final RedisBytes key) {
        return redisCore.getString(key);
    }

    @Override
    public boolean hset(final RedisBytes key, final RedisBytes field, final RedisBytes value) {
        return redisCore.hset(key, field, value);
    }

    @Override
    public RedisBytes hget(final RedisBytes key, final RedisBytes field) {
        return redisCore.hget(key, field);
    }

    @Override
    public List<RedisBytes> keys(final RedisBytes pattern) {
        return redisCore.keys(pattern);
    }

    @Override
    public long currentTimeMillis() {
        return redisCore.currentTimeMillis();
    }

    @Override
    public RedisCore getRedisCore() {
        return redisCore;
    }

    // ========== 持久化 ==========

    @Override
    public void writeAof(final RespArray command) {
        if (aofManager == null) {
            return;
        }
        try {
            aofManager.append(command);
        } catch (IOException e) {
            log.error("写入AOF失败，命令已在内存中生效: {}", command, e);
        }
    }

    @Override
    public boolean isAofEnabled() {
        return aofManager != null;
    }

    @Override
    public AofManager getAofManager() {
        return aofManager;
    }

    @Override
    public int loadAof() throws IOException {
        if (aofManager == null) {
            return 0;
        }
        final long start = System.currentTimeMillis();
        final int applied = aofManager.load(new CommandExecutorImpl(this));
        log.info("AOF重放完成，应用命令数: {}，耗时: {}ms", applied, System.currentTimeMillis() - start);
        return applied;
    }

    // ========== 系统管理 ==========

    @Override
    public CommandDispatcher getDispatcher() {
        return dispatcher;
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        if (aofManager != null) {
            try {
                aofManager.close();
                log.info("AOF已刷盘并关闭");
            } catch (IOException e) {
                log.error("关闭AOF失败", e);
            }
        }
    }
}
