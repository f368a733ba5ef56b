package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;

public class Echo implements Command {

    private BulkString message;

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 2) {
            throw CommandException.wrongArity("echo");
        }
        message = BulkString.create(array[1].asBytes());
    }

    @Override
    public Resp handle() {
        return message;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
