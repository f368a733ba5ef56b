package site.respkv.server.command.executor;

import lombok.extern.slf4j.Slf4j;
import site.respkv.command.CommandType;
import site.respkv.core.command.CommandExecutor;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;

/**
 * AOF重放使用的命令执行器
 *
 * <p>经过分发器执行但不追加AOF，也不产生客户端回复。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class CommandExecutorImpl implements CommandExecutor {

    private final RedisContext redisContext;

    public CommandExecutorImpl(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public boolean executeCommand(final RedisBytes[] command) {
        if (command.length == 0 || CommandType.findByBytes(command[0]) == null) {
            return false;
        }

        final Resp[] array = new Resp[command.length];
        for (int i = 0; i < command.length; i++) {
            array[i] = BulkString.create(command[i]);
        }

        final Resp result = redisContext.getDispatcher().execute(new RespArray(array));
        if (result instanceof Errors) {
            log.warn("重放命令返回错误: {} -> {}", command[0], ((Errors) result).getContent());
        }
        return true;
    }
}
