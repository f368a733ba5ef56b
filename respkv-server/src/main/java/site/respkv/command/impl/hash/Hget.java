package site.respkv.command.impl.hash;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;

public class Hget implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private RedisBytes field;

    public Hget(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 3) {
            throw CommandException.wrongArity("hget");
        }
        key = array[1].asBytes();
        field = array[2].asBytes();
    }

    @Override
    public Resp handle() {
        return BulkString.create(redisContext.hget(key, field));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
