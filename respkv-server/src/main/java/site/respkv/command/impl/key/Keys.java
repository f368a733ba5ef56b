package site.respkv.command.impl.key;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;

import java.util.List;

/**
 * KEYS命令
 *
 * <p>只支持两种模式：以 {@code *} 结尾的前缀匹配，以及不含通配的精确匹配。
 * 结果顺序不保证。
 *
 * @author respkv
 * @since 1.0.0
 */
public class Keys implements Command {

    private final RedisContext redisContext;
    private RedisBytes pattern;

    public Keys(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.KEYS;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 2) {
            throw CommandException.wrongArity("keys");
        }
        pattern = array[1].asBytes();
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> keys = redisContext.keys(pattern);
        final Resp[] result = new Resp[keys.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = BulkString.create(keys.get(i));
        }
        return new RespArray(result);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
