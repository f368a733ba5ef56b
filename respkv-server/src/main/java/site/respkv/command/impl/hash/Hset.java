package site.respkv.command.impl.hash;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;

/**
 * HSET命令：{@code HSET key field value}，只接受一个字段，回复OK
 *
 * @author respkv
 * @since 1.0.0
 */
public class Hset implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private RedisBytes field;
    private RedisBytes value;

    public Hset(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 4) {
            throw CommandException.wrongArity("hset");
        }
        key = array[1].asBytes();
        field = array[2].asBytes();
        value = array[3].asBytes();
    }

    @Override
    public Resp handle() {
        redisContext.hset(key, field, value);
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
