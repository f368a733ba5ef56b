package site.respkv.command.impl.string;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;

/**
 * GET命令：键不存在或已过期回复null批量字符串
 *
 * @author respkv
 * @since 1.0.0
 */
public class Get implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;

    public Get(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 2) {
            throw CommandException.wrongArity("get");
        }
        key = array[1].asBytes();
    }

    @Override
    public Resp handle() {
        return BulkString.create(redisContext.getString(key));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
