package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

/**
 * PING命令：无参数回复PONG，带一个参数时原样回复该参数
 *
 * @author respkv
 * @since 1.0.0
 */
public class Ping implements Command {

    private BulkString message;

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 2) {
            throw CommandException.wrongArity("ping");
        }
        if (array.length == 2) {
            message = BulkString.create(array[1].asBytes());
        }
    }

    @Override
    public Resp handle() {
        return message == null ? SimpleString.PONG : message;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
