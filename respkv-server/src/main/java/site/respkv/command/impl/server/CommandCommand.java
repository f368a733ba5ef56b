package site.respkv.command.impl.server;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

/**
 * COMMAND命令：redis-cli 连接时会发送 {@code COMMAND DOCS}，这里只把参数作为简单字符串回复
 *
 * <p>简单字符串不能包含换行，参数中的 \r 和 \n 替换为空格。
 *
 * @author respkv
 * @since 1.0.0
 */
public class CommandCommand implements Command {

    private String argument;

    @Override
    public CommandType getType() {
        return CommandType.COMMAND;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 2) {
            throw CommandException.wrongArity("command");
        }
        argument = array[1].asText().replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public Resp handle() {
        return SimpleString.valueOf(argument);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
