package site.respkv.protocol;

import lombok.Getter;

/**
 * 类型访问错误：期望某种RESP值却得到了另一种。
 *
 * <p>由 {@link Resp#asBulkString()}、{@link Resp#asArray()} 等访问器抛出，
 * 取代直接强制类型转换。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class RespTypeException extends RuntimeException {

    /** 期望的类型 */
    private final RespType expected;

    /** 实际的类型 */
    private final RespType actual;

    public RespTypeException(final RespType expected, final RespType actual) {
        super("期望 " + expected + " 实际为 " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public RespTypeException(final RespType expected, final RespType actual, final String message) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }
}
