package site.respkv.server.context;

import site.respkv.aof.AofManager;
import site.respkv.command.CommandDispatcher;
import site.respkv.core.RedisCore;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.RespArray;

import java.io.IOException;
import java.util.List;

/**
 * 服务器上下文接口，命令和网络层访问引擎的统一入口
 *
 * <p>启动时创建一次并显式传递，不使用单例。持有数据引擎、可选的AOF管理器以及命令分发器。
 * 实现类必须是线程安全的。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface RedisContext {

    // ========== 数据操作接口 ==========

    void setString(RedisBytes key, RedisBytes value, long expireAtMillis);

    RedisBytes getString(RedisBytes key);

    boolean hset(RedisBytes key, RedisBytes field, RedisBytes value);

    RedisBytes hget(RedisBytes key, RedisBytes field);

    List<RedisBytes> keys(RedisBytes pattern);

    /**
     * 引擎时钟的当前时间，SET的相对过期时间基于此换算
     */
    long currentTimeMillis();

    RedisCore getRedisCore();

    // ========== 持久化接口 ==========

    /**
     * 追加一条已成功执行的写命令。写入失败只记录日志，不影响已经生效的内存修改。
     *
     * @param command 原始命令帧
     */
    void writeAof(RespArray command);

    boolean isAofEnabled();

    /**
     * @return AOF管理器，未启用时为null
     */
    AofManager getAofManager();

    /**
     * 重放AOF文件，必须在开始接受连接之前调用
     *
     * @return 应用的命令数，未启用AOF时为0
     * @throws IOException 读取文件失败
     */
    int loadAof() throws IOException;

    // ========== 系统管理接口 ==========

    CommandDispatcher getDispatcher();

    /**
     * 关闭上下文，AOF做最后一次刷盘后关闭
     */
    void shutdown();
}
