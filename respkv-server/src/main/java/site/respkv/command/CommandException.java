package site.respkv.command;

import site.respkv.protocol.Errors;

/**
 * 应用层错误，消息即回复给客户端的错误文本
 *
 * <p>由命令在参数校验或执行时抛出，分发器转换为 {@link Errors} 回复，不会断开连接。
 *
 * @author respkv
 * @since 1.0.0
 */
public class CommandException extends RuntimeException {

    public CommandException(final String message) {
        super(message);
    }

    public static CommandException wrongArity(final String commandName) {
        return new CommandException("ERR wrong number of arguments for '" + commandName + "' command");
    }

    public static CommandException notInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }

    public static CommandException syntaxError() {
        return new CommandException("ERR syntax error");
    }

    public static CommandException invalidExpireTime(final String commandName) {
        return new CommandException("ERR invalid expire time in '" + commandName + "' command");
    }

    public Errors toErrors() {
        return new Errors(getMessage());
    }
}
