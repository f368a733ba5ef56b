package site.respkv.command;

import lombok.Getter;
import site.respkv.command.impl.Echo;
import site.respkv.command.impl.Ping;
import site.respkv.command.impl.hash.Hget;
import site.respkv.command.impl.hash.Hset;
import site.respkv.command.impl.key.Keys;
import site.respkv.command.impl.server.CommandCommand;
import site.respkv.command.impl.string.Get;
import site.respkv.command.impl.string.Set;
import site.respkv.datastructure.RedisBytes;
import site.respkv.server.context.RedisContext;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令类型枚举，即命令注册表
 *
 * <p>命令名大小写不敏感：先按原字节查缓存，未命中再转大写查找。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** PING命令：测试服务器连接 */
    PING("PING"),
    /** ECHO命令：原样返回参数 */
    ECHO("ECHO"),
    /** COMMAND命令：以简单字符串回复参数 */
    COMMAND("COMMAND"),
    /** SET命令：设置键值对，可带过期时间 */
    SET("SET"),
    /** GET命令：获取键值 */
    GET("GET"),
    /** HSET命令：设置哈希字段 */
    HSET("HSET"),
    /** HGET命令：获取哈希字段 */
    HGET("HGET"),
    /** KEYS命令：按前缀或精确名查找键 */
    KEYS("KEYS");

    /** 命令名字节 */
    private final RedisBytes commandBytes;

    /** 命令查找缓存 */
    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    CommandType(final String commandName) {
        this.commandBytes = RedisBytes.fromString(commandName);
    }

    /**
     * 根据命令名字节查找命令类型
     *
     * @param commandBytes 命令名
     * @return 对应的CommandType，不存在返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        return COMMAND_CACHE.get(RedisBytes.fromString(commandBytes.getString().toUpperCase(Locale.ROOT)));
    }

    /**
     * 根据命令名字符串查找命令类型，AOF重放使用
     *
     * @param commandName 命令名称
     * @return 对应的CommandType，不存在返回null
     */
    public static CommandType findByName(final String commandName) {
        if (commandName == null || commandName.isEmpty()) {
            return null;
        }
        return findByBytes(RedisBytes.fromString(commandName));
    }

    /**
     * 创建命令实例
     *
     * @param context 引擎上下文
     * @return 命令实例
     */
    public Command createCommand(final RedisContext context) {
        switch (this) {
            case PING:
                return new Ping();
            case ECHO:
                return new Echo();
            case COMMAND:
                return new CommandCommand();
            case SET:
                return new Set(context);
            case GET:
                return new Get(context);
            case HSET:
                return new Hset(context);
            case HGET:
                return new Hget(context);
            case KEYS:
                return new Keys(context);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
