package site.respkv.command;

import lombok.extern.slf4j.Slf4j;
import site.respkv.core.WrongTypeException;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespTypeException;
import site.respkv.server.context.RedisContext;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 命令分发器：一帧请求进，一个回复出
 *
 * <p>处理流程：
 * <ol>
 *     <li>校验顶层形状，必须是非空数组</li>
 *     <li>按元素0查找命令，创建实例并校验参数</li>
 *     <li>执行；写命令成功后把原始帧追加到AOF</li>
 * </ol>
 *
 * <p>写命令的"执行 + 追加"在按键分段的锁内完成，同一个键的AOF顺序与内存中的应用顺序一致，
 * 不同键的写入仍可并行。被拒绝的命令不会写入AOF。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    static final String EXPECTED_ARRAY = "ERR invalid request, expected array";
    static final String EXPECTED_NON_EMPTY = "ERR invalid request, expected array length > 0";
    static final String EXPECTED_BULK = "ERR Protocol error: expected bulk string";

    /** 锁分段数，必须是2的幂 */
    private static final int LOCK_STRIPES = 64;

    private final RedisContext redisContext;
    private final ReentrantLock[] writeLocks;

    public CommandDispatcher(final RedisContext redisContext) {
        this.redisContext = redisContext;
        this.writeLocks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            writeLocks[i] = new ReentrantLock();
        }
    }

    /**
     * 处理客户端请求，写命令成功后追加AOF
     *
     * @param frame 解码后的请求帧
     * @return 回复值，错误以 {@link Errors} 表示
     */
    public Resp process(final Resp frame) {
        return dispatch(frame, true);
    }

    /**
     * 执行命令但不追加AOF，供重放使用
     *
     * @param frame 命令帧
     * @return 回复值
     */
    public Resp execute(final Resp frame) {
        return dispatch(frame, false);
    }

    private Resp dispatch(final Resp frame, final boolean appendToAof) {
        if (!(frame instanceof RespArray) || ((RespArray) frame).isNull()) {
            return new Errors(EXPECTED_ARRAY);
        }
        final RespArray request = (RespArray) frame;
        final Resp[] array = request.getContent();
        if (array.length == 0) {
            return new Errors(EXPECTED_NON_EMPTY);
        }

        try {
            final RedisBytes commandName = array[0].asBytes();
            final CommandType commandType = CommandType.findByBytes(commandName);
            if (commandType == null) {
                return new Errors("ERR unknown command '" + commandName.getString() + "'");
            }

            final Command command = commandType.createCommand(redisContext);
            command.setContext(array);
            if (!command.isWriteCommand()) {
                return command.handle();
            }
            return handleWriteCommand(command, request, appendToAof);
        } catch (CommandException e) {
            return e.toErrors();
        } catch (WrongTypeException e) {
            return new Errors(e.getMessage());
        } catch (RespTypeException e) {
            return new Errors(EXPECTED_BULK);
        } catch (RuntimeException e) {
            log.error("执行命令时发生错误", e);
            return new Errors("ERR " + e.getMessage());
        }
    }

    private Resp handleWriteCommand(final Command command, final RespArray request, final boolean appendToAof) {
        final ReentrantLock lock = lockFor(request.getContent());
        lock.lock();
        try {
            final Resp result = command.handle();
            if (appendToAof && !(result instanceof Errors) && redisContext.isAofEnabled()) {
                redisContext.writeAof(request);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(final Resp[] array) {
        if (array.length < 2) {
            return writeLocks[0];
        }
        return writeLocks[array[1].asBytes().hashCode() & (LOCK_STRIPES - 1)];
    }
}
