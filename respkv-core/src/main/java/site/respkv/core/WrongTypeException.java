package site.respkv.core;

/**
 * 对持有另一种类型值的键执行了不兼容的操作
 *
 * @author respkv
 * @since 1.0.0
 */
public class WrongTypeException extends RuntimeException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
