package site.respkv.command.impl.string;

import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;

/**
 * SET命令
 *
 * <p>格式：{@code SET key value [EX seconds | PX milliseconds]}，选项关键字大小写不敏感。
 * 过期时间在参数校验时换算为绝对时间戳，非正数或溢出都视为非法过期时间，键不会被写入。
 *
 * @author respkv
 * @since 1.0.0
 */
public class Set implements Command {

    private static final long NO_EXPIRE = -1L;

    private final RedisContext redisContext;
    private RedisBytes key;
    private RedisBytes value;
    private long expireAtMillis = NO_EXPIRE;

    public Set(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 3 && array.length != 5) {
            throw CommandException.wrongArity("set");
        }
        key = array[1].asBytes();
        value = array[2].asBytes();
        if (array.length == 5) {
            expireAtMillis = parseExpire(array[3].asText(), array[4].asText());
        }
    }

    private long parseExpire(final String option, final String amountText) {
        final long unitMillis;
        if ("EX".equalsIgnoreCase(option)) {
            unitMillis = 1000L;
        } else if ("PX".equalsIgnoreCase(option)) {
            unitMillis = 1L;
        } else {
            throw CommandException.syntaxError();
        }

        final long amount;
        try {
            amount = Long.parseLong(amountText);
        } catch (NumberFormatException e) {
            throw CommandException.notInteger();
        }
        if (amount <= 0) {
            throw CommandException.invalidExpireTime("set");
        }
        try {
            return Math.addExact(redisContext.currentTimeMillis(), Math.multiplyExact(amount, unitMillis));
        } catch (ArithmeticException e) {
            throw CommandException.invalidExpireTime("set");
        }
    }

    @Override
    public Resp handle() {
        redisContext.setString(key, value, expireAtMillis);
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
