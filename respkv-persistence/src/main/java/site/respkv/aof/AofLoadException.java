package site.respkv.aof;

/**
 * AOF文件损坏，重放无法安全继续，启动应当中止
 *
 * @author respkv
 * @since 1.0.0
 */
public class AofLoadException extends RuntimeException {

    public AofLoadException(final String message) {
        super(message);
    }

    public AofLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
