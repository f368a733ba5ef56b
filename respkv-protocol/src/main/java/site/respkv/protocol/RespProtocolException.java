package site.respkv.protocol;

/**
 * 帧格式错误：数据不符合RESP协议，连接无法再可靠地重新同步。
 *
 * @author respkv
 * @since 1.0.0
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(final String message) {
        super(message);
    }

    public RespProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
